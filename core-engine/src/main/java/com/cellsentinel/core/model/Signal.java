package com.cellsentinel.core.model;

/**
 * The two traffic signals classified independently for every cell.
 *
 * @since 1.0.0
 */
public enum Signal {

    /** Circuit-switched (voice) traffic. */
    CS,

    /** Packet data traffic. */
    DATA
}
