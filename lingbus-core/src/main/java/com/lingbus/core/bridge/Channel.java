package com.lingbus.core.bridge;

import com.lingbus.core.event.EventBus;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 跨插件频道
 * 持有频道总线，以及按 "&lt;channelId&gt;:&lt;pluginId&gt;" 记录的转发订阅（用于拆除）。
 */
public class Channel {

    @Getter
    private final String channelId;
    @Getter
    private final EventBus bus;
    private final List<String> participants = new ArrayList<>();
    private final Map<String, List<EventBus.Subscription>> subscriptions = new LinkedHashMap<>();

    Channel(String channelId, EventBus bus) {
        this.channelId = channelId;
        this.bus = bus;
    }

    /**
     * 频道事件类型前缀 "channel:&lt;channelId&gt;:"
     */
    public String typePrefix() {
        return typePrefix(channelId);
    }

    public static String typePrefix(String channelId) {
        return "channel:" + channelId + ":";
    }

    /**
     * 已接入的插件，按接入顺序
     */
    public List<String> getParticipants() {
        return Collections.unmodifiableList(participants);
    }

    public boolean hasParticipant(String pluginId) {
        return participants.contains(pluginId);
    }

    synchronized void attach(String pluginId, List<EventBus.Subscription> handles) {
        participants.add(pluginId);
        subscriptions.put(subscriptionKey(pluginId), List.copyOf(handles));
    }

    /**
     * 取消所有转发订阅并清空频道总线
     */
    synchronized void teardown() {
        for (List<EventBus.Subscription> handles : subscriptions.values()) {
            handles.forEach(EventBus.Subscription::unsubscribe);
        }
        subscriptions.clear();
        participants.clear();
        bus.clear();
    }

    String subscriptionKey(String pluginId) {
        return channelId + ":" + pluginId;
    }

    synchronized int getSubscriptionCount() {
        return subscriptions.values().stream().mapToInt(List::size).sum();
    }
}
