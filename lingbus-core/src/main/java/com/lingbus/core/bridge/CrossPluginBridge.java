package com.lingbus.core.bridge;

import com.lingbus.api.event.EmitOptions;
import com.lingbus.api.event.EventPriority;
import com.lingbus.api.event.PluginEvent;
import com.lingbus.api.exception.DuplicateRegistrationException;
import com.lingbus.core.config.LingBusConfig;
import com.lingbus.core.event.EventBus;
import com.lingbus.core.isolation.EventSandbox;
import com.lingbus.core.isolation.PluginEventForwarder;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 跨插件桥
 * <p>
 * 为每个频道建立独立总线，并在频道与每个参与插件的沙箱之间建立双向转发：
 * <ol>
 *     <li>规则 A（插件 → 频道）：监听共享总线，metadata.pluginId 为该插件且类型以
 *     "channel:&lt;channelId&gt;:" 开头的事件转入频道总线，并标记 targetPlugin</li>
 *     <li>规则 B（频道 → 插件）：监听频道总线，来源已是 "plugin:" 的事件直接丢弃（防环），
 *     否则 targetPlugin 为该插件的事件投递到其私有总线</li>
 * </ol>
 */
@Slf4j
public class CrossPluginBridge {

    private final PluginEventForwarder forwarder;
    private final int maxDispatchDepth;

    // 频道表：Key=ChannelId, Value=Channel
    private final Map<String, Channel> channels = new ConcurrentHashMap<>();

    public CrossPluginBridge(PluginEventForwarder forwarder) {
        this(forwarder, LingBusConfig.defaults());
    }

    public CrossPluginBridge(PluginEventForwarder forwarder, LingBusConfig config) {
        this.forwarder = forwarder;
        this.maxDispatchDepth = config.getMaxDispatchDepth();
    }

    /**
     * 创建频道
     *
     * @param channelId        频道ID
     * @param allowedPluginIds 参与插件，没有沙箱的插件会被静默跳过
     * @return 频道总线
     * @throws DuplicateRegistrationException 频道ID已存在
     */
    public EventBus createChannel(String channelId, List<String> allowedPluginIds) {
        if (channelId == null || channelId.isBlank()) {
            throw new IllegalArgumentException("channelId is required");
        }
        Channel channel = new Channel(channelId, new EventBus("channel:" + channelId, maxDispatchDepth));
        if (channels.putIfAbsent(channelId, channel) != null) {
            throw new DuplicateRegistrationException("channel", channelId);
        }

        if (allowedPluginIds != null) {
            for (String pluginId : allowedPluginIds) {
                Optional<EventSandbox> sandbox = forwarder.getSandboxInstance(pluginId);
                if (sandbox.isEmpty()) {
                    log.debug("[{}] Plugin {} has no sandbox, not wired into channel", channelId, pluginId);
                    continue;
                }
                if (channel.hasParticipant(pluginId)) {
                    continue;
                }
                setupChannelForwarding(channel, pluginId, sandbox.get());
            }
        }

        log.info("[{}] Channel created, participants={}", channelId, channel.getParticipants());
        return channel.getBus();
    }

    /**
     * 拆除频道：取消全部转发订阅并移除
     *
     * @return 频道存在并被移除时返回 true
     */
    public boolean destroyChannel(String channelId) {
        Channel channel = channelId == null ? null : channels.remove(channelId);
        if (channel == null) {
            return false;
        }
        channel.teardown();
        log.info("[{}] Channel destroyed", channelId);
        return true;
    }

    public Optional<Channel> getChannel(String channelId) {
        return channelId == null ? Optional.empty() : Optional.ofNullable(channels.get(channelId));
    }

    public Set<String> getChannelIds() {
        return Set.copyOf(channels.keySet());
    }

    private void setupChannelForwarding(Channel channel, String pluginId, EventSandbox sandbox) {
        String channelId = channel.getChannelId();
        String prefix = channel.typePrefix();
        EventBus channelBus = channel.getBus();
        EventBus baseBus = forwarder.getBaseBus();

        // 规则 A：插件 -> 频道
        EventBus.Subscription unsubBase = baseBus.on(EventBus.WILDCARD, event -> {
            if (!pluginId.equals(event.getMetadataString(PluginEvent.META_PLUGIN_ID))
                    || !event.getType().startsWith(prefix)) {
                return;
            }
            Map<String, Object> metadata = new LinkedHashMap<>(event.getMetadata());
            metadata.put(PluginEvent.META_TARGET_PLUGIN, pluginId);
            channelBus.publish(event.toBuilder()
                    .metadata(metadata)
                    .priority(EventPriority.IMMEDIATE)
                    .build());
        });

        // 规则 B：频道 -> 插件
        EventBus.Subscription unsubChannel = channelBus.on(EventBus.WILDCARD, event -> {
            // 已由插件发出的事件不再回送，防止形成环路
            if (event.isPluginSourced()) {
                return;
            }
            if (!pluginId.equals(event.getMetadataString(PluginEvent.META_TARGET_PLUGIN))) {
                return;
            }
            sandbox.getBus().emit(event.getType(), event.getPayload(), EmitOptions.builder()
                    .priority(EventPriority.IMMEDIATE)
                    .source(PluginEvent.CHANNEL_SOURCE_PREFIX + channelId)
                    .metadata(Map.of(PluginEvent.META_CHANNEL_ID, channelId))
                    .build());
        });

        List<EventBus.Subscription> handles = new ArrayList<>(2);
        handles.add(unsubBase);
        handles.add(unsubChannel);
        channel.attach(pluginId, handles);
        log.debug("[{}] Wired plugin {} ({})", channelId, pluginId, channel.subscriptionKey(pluginId));
    }
}
