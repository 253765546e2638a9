package com.lingbus.core.isolation;

import com.lingbus.api.event.EmitOptions;
import com.lingbus.api.event.PluginEvent;
import com.lingbus.api.security.PermissionChecker;
import com.lingbus.core.event.EventBus;
import com.lingbus.core.security.EventValidator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("EventSandbox 单元测试")
class EventSandboxTest {

    private static final String PLUGIN_ID = "plugin-1";

    private EventBus sharedBus;
    private List<PluginEvent> shared;

    @BeforeEach
    void setUp() {
        sharedBus = new EventBus("shared");
        shared = new ArrayList<>();
        sharedBus.on("*", shared::add);
    }

    @Nested
    @DisplayName("权限过滤")
    class PermissionGatingTests {

        @Test
        @DisplayName("允许的类型转发一次并打上插件来源")
        void allowedEventShouldBeForwardedOnce() {
            EventSandbox sandbox = new EventSandbox(PLUGIN_ID, sharedBus, List.of("emit:allowed"));

            sandbox.getBus().emit("allowed", Map.of("n", 1));

            assertEquals(1, shared.size());
            PluginEvent forwarded = shared.get(0);
            assertEquals("allowed", forwarded.getType());
            assertEquals("plugin:" + PLUGIN_ID, forwarded.getSource());
            assertEquals(PLUGIN_ID, forwarded.getMetadataString(PluginEvent.META_PLUGIN_ID));
            assertEquals(Boolean.TRUE, forwarded.getMetadata().get(PluginEvent.META_SANDBOXED));
            assertEquals(Map.of("n", 1), forwarded.getPayload());
        }

        @Test
        @DisplayName("未授权的类型只在本地投递")
        void deniedEventShouldStayLocal() {
            EventSandbox sandbox = new EventSandbox(PLUGIN_ID, sharedBus, List.of("emit:allowed"));
            List<PluginEvent> local = new ArrayList<>();
            sandbox.getBus().on("denied", local::add);

            sandbox.getBus().emit("denied", null);

            assertTrue(shared.isEmpty());
            assertEquals(1, local.size());
        }

        @Test
        @DisplayName("通配权限转发所有类型")
        void wildcardShouldForwardEverything() {
            EventSandbox sandbox = new EventSandbox(PLUGIN_ID, sharedBus, List.of("emit:*"));

            sandbox.getBus().emit("a", null);
            sandbox.getBus().emit("b", null);
            sandbox.getBus().emit("channel:x:y", null);

            assertEquals(List.of("a", "b", "channel:x:y"), shared.stream().map(PluginEvent::getType).toList());
        }

        @Test
        @DisplayName("没有权限时什么都不转发")
        void noPermissionsShouldForwardNothing() {
            EventSandbox sandbox = new EventSandbox(PLUGIN_ID, sharedBus, List.of());

            sandbox.getBus().emit("a", null);

            assertTrue(shared.isEmpty());
        }

        @Test
        @DisplayName("宿主权限服务拒绝时不转发")
        void hostCheckerShouldVeto(@Mock PermissionChecker hostChecker) {
            when(hostChecker.canEmit(PLUGIN_ID, "a")).thenReturn(false);
            when(hostChecker.canEmit(PLUGIN_ID, "b")).thenReturn(true);
            EventSandbox sandbox = new EventSandbox(PLUGIN_ID, sharedBus, PermissionSet.of("emit:*"),
                    hostChecker, new EventValidator(), EventBus.DEFAULT_MAX_DISPATCH_DEPTH);

            sandbox.getBus().emit("a", null);
            sandbox.getBus().emit("b", null);

            assertEquals(List.of("b"), shared.stream().map(PluginEvent::getType).toList());
            assertFalse(sandbox.canForward("a"));
            assertTrue(sandbox.canForward("b"));
        }
    }

    @Nested
    @DisplayName("转发内容")
    class ForwardedContentTests {

        @Test
        @DisplayName("自引用载荷不会让 emit 抛出，转发时截断循环")
        @SuppressWarnings("unchecked")
        void cyclicPayloadShouldBeForwardedSafely() {
            EventSandbox sandbox = new EventSandbox(PLUGIN_ID, sharedBus, List.of("emit:*"));
            List<PluginEvent> local = new ArrayList<>();
            sandbox.getBus().on("x", local::add);
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("id", 7);
            payload.put("self", payload);

            assertDoesNotThrow(() -> sandbox.getBus().emit("x", payload));

            assertEquals(1, local.size());
            assertSame(payload, local.get(0).getPayload());
            assertEquals(1, shared.size());
            Map<String, Object> forwarded = (Map<String, Object>) shared.get(0).getPayload();
            assertEquals(7, forwarded.get("id"));
            assertEquals(EventValidator.CIRCULAR_REFERENCE, forwarded.get("self"));
        }

        @Test
        @DisplayName("转发的载荷应被清洗")
        @SuppressWarnings("unchecked")
        void forwardedPayloadShouldBeSanitized() {
            EventSandbox sandbox = new EventSandbox(PLUGIN_ID, sharedBus, List.of("emit:*"));
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("__proto__", Map.of("isAdmin", true));
            payload.put("data", 1);

            sandbox.getBus().emit("t", payload);

            Map<String, Object> forwarded = (Map<String, Object>) shared.get(0).getPayload();
            assertEquals(Map.of("data", 1), forwarded);
        }

        @Test
        @DisplayName("插件无法伪造身份或来源")
        void identityShouldNotBeForgeable() {
            EventSandbox sandbox = new EventSandbox(PLUGIN_ID, sharedBus, List.of("emit:*"));

            sandbox.getBus().emit("t", null, EmitOptions.builder()
                    .metadata(Map.of(PluginEvent.META_PLUGIN_ID, "plugin-2", "custom", "kept"))
                    .build());

            assertEquals(1, shared.size());
            assertEquals(PLUGIN_ID, shared.get(0).getMetadataString(PluginEvent.META_PLUGIN_ID));
            assertEquals("kept", shared.get(0).getMetadataString("custom"));
        }

        @Test
        @DisplayName("已带插件或频道来源的事件不再转发")
        void inboundEventsShouldStayLocal() {
            EventSandbox sandbox = new EventSandbox(PLUGIN_ID, sharedBus, List.of("emit:*"));
            List<PluginEvent> local = new ArrayList<>();
            sandbox.getBus().on("*", local::add);

            sandbox.getBus().emit("t", null, EmitOptions.builder().source("plugin:plugin-2").build());
            sandbox.getBus().emit("t", null, EmitOptions.builder().source("channel:test").build());

            assertTrue(shared.isEmpty());
            assertEquals(2, local.size());
        }
    }

    @Nested
    @DisplayName("销毁")
    class DestroyTests {

        @Test
        @DisplayName("销毁后 emit 不抛异常也不转发")
        void destroyedSandboxShouldBeNoop() {
            EventSandbox sandbox = new EventSandbox(PLUGIN_ID, sharedBus, List.of("emit:*"));
            EventBus bus = sandbox.getBus();

            sandbox.destroy();

            assertFalse(sandbox.isActive());
            assertDoesNotThrow(() -> bus.emit("t", null));
            assertTrue(shared.isEmpty());
            assertEquals(0, bus.getSubscriptionCount());
        }

        @Test
        @DisplayName("重复销毁是安全的")
        void destroyShouldBeIdempotent() {
            EventSandbox sandbox = new EventSandbox(PLUGIN_ID, sharedBus, List.of("emit:*"));

            sandbox.destroy();

            assertDoesNotThrow(sandbox::destroy);
        }

        @Test
        @DisplayName("缺少 pluginId 应被拒绝")
        void blankPluginIdShouldBeRejected() {
            assertThrows(IllegalArgumentException.class, () -> new EventSandbox(" ", sharedBus, List.of()));
        }
    }
}
