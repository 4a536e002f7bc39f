package uy.gub.bps.pocketzombies.domain.service;

import uy.gub.bps.pocketzombies.domain.model.EventCard;

import java.util.List;

public interface EventCardSupply {
    List<EventCard> eventCards();
}
