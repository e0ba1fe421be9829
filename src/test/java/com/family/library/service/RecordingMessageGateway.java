package com.family.library.service;

import com.family.library.dto.OutboundMessage;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * Gateway that keeps everything it was asked to deliver.
 */
public class RecordingMessageGateway implements MessageGateway {

    private final List<OutboundMessage> sent = new CopyOnWriteArrayList<>();
    private final List<String> acknowledged = new CopyOnWriteArrayList<>();

    @Override
    public void send(OutboundMessage message) {
        sent.add(message);
    }

    @Override
    public void acknowledge(String callbackId) {
        acknowledged.add(callbackId);
    }

    public List<OutboundMessage> getSent() {
        return sent;
    }

    public List<String> texts() {
        return sent.stream().map(OutboundMessage::getText).collect(Collectors.toList());
    }

    public OutboundMessage last() {
        return sent.get(sent.size() - 1);
    }

    public List<String> getAcknowledged() {
        return acknowledged;
    }

    public void clear() {
        sent.clear();
        acknowledged.clear();
    }
}
