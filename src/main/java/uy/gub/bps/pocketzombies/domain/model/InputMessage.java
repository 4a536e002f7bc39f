package uy.gub.bps.pocketzombies.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class InputMessage {
    @JsonProperty("t")
    private String type; // MOVE, BASH, COWER, TOTEM, DETAILS, CHOICE
    @JsonProperty("d")
    private String payload; // direction letter or the answer to a prompt
}
