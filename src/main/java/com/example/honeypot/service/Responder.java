package com.example.honeypot.service;

/**
 * Produces the outbound reply for a turn. May block; callers bound it with a timeout.
 */
public interface Responder {

    /**
     * @throws ResponderException when no reply can be produced
     */
    String reply(ResponderRequest request);
}
