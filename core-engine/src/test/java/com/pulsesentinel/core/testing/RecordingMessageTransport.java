package com.pulsesentinel.core.testing;

import com.pulsesentinel.core.notify.ChannelDeliveryException;
import com.pulsesentinel.core.notify.MessageTransport;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Fake {@link MessageTransport} capturing every message.
 */
public class RecordingMessageTransport implements MessageTransport {

    private final List<Message> messages = new CopyOnWriteArrayList<>();

    @Override
    public void send(List<String> recipients, String subject, String body) throws ChannelDeliveryException {
        messages.add(new Message(recipients, subject, body));
    }

    public List<Message> messages() {
        return messages;
    }

    /**
     * One captured message.
     */
    public static final class Message {
        public final List<String> recipients;
        public final String subject;
        public final String body;

        Message(List<String> recipients, String subject, String body) {
            this.recipients = List.copyOf(recipients);
            this.subject = subject;
            this.body = body;
        }
    }
}
