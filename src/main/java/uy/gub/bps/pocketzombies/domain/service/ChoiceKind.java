package uy.gub.bps.pocketzombies.domain.service;

public enum ChoiceKind {
    ENTRY_SIDE,
    FIGHT_OR_RUN,
    ESCAPE_DIRECTION,
    REPLACE_ITEM,
    ITEM_TO_DISCARD
}
