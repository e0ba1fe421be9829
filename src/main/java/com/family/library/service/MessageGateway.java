package com.family.library.service;

import com.family.library.dto.OutboundMessage;

/**
 * Outbound side of the messaging platform. Delivery is best effort:
 * implementations log failures instead of throwing.
 */
public interface MessageGateway {

    void send(OutboundMessage message);

    /**
     * Stops the client-side spinner of a clicked button.
     */
    void acknowledge(String callbackId);
}
