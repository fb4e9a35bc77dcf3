package com.wgbot.application.support;

import com.wgbot.application.ports.NotificationException;
import com.wgbot.application.ports.NotifierPort;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

public class RecordingNotifier implements NotifierPort {

    public record Sent(long destinationId, String text) {
    }

    public final List<Sent> sent = new ArrayList<>();
    public final Set<Long> unreachable = new HashSet<>();

    @Override
    public synchronized void notify(long destinationId, String text) {
        if (unreachable.contains(destinationId)) {
            throw new NotificationException("chat " + destinationId + " unreachable");
        }
        sent.add(new Sent(destinationId, text));
    }

    public synchronized List<Sent> to(long destinationId) {
        return sent.stream().filter(s -> s.destinationId() == destinationId).toList();
    }
}
