package com.lingbus.core.security;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("ErrorBoundary 单元测试")
class ErrorBoundaryTest {

    private static final String PLUGIN_ID = "test-plugin";

    @Mock
    private ErrorCallback onError;

    private ErrorBoundary boundary;

    @BeforeEach
    void setUp() {
        // onCaptured 是默认方法，需要走真实实现才能转发到 onError
        lenient().doCallRealMethod().when(onError).onCaptured(any());
        boundary = new ErrorBoundary(PLUGIN_ID, onError);
    }

    @Nested
    @DisplayName("同步函数")
    class SyncTests {

        @Test
        @DisplayName("同步异常被吞掉，回调收到原始异常")
        void syncThrowShouldBeSwallowed() {
            Runnable wrapped = boundary.wrap(() -> {
                throw new IllegalStateException("x");
            });

            assertDoesNotThrow(wrapped::run);

            ArgumentCaptor<Throwable> captor = ArgumentCaptor.forClass(Throwable.class);
            verify(onError, times(1)).onError(captor.capture(), eq(PLUGIN_ID));
            assertEquals("x", captor.getValue().getMessage());
        }

        @Test
        @DisplayName("插件抛出的 Error 也被拦截")
        void errorShouldBeContained() {
            Consumer<String> wrapped = boundary.wrapConsumer(s -> {
                throw new AssertionError("broken " + s);
            }, "assert");

            assertDoesNotThrow(() -> wrapped.accept("input"));
            verify(onError).onError(any(AssertionError.class), eq(PLUGIN_ID));
        }

        @Test
        @DisplayName("函数异常时返回 null")
        void functionShouldReturnNullOnThrow() {
            Function<String, Integer> wrapped = boundary.wrapFunction(s -> {
                throw new IllegalArgumentException("bad " + s);
            }, "parse");

            assertNull(wrapped.apply("input"));
            verify(onError).onError(any(IllegalArgumentException.class), eq(PLUGIN_ID));
        }

        @Test
        @DisplayName("正常调用应透传参数与返回值")
        void successShouldPassThrough() {
            Function<Integer, Integer> doubled = boundary.wrapFunction(i -> i * 2, "double");
            Supplier<String> supplier = boundary.wrapSupplier(() -> "ok", "supply");
            AtomicReference<String> seen = new AtomicReference<>();
            Consumer<String> consumer = boundary.wrapConsumer(seen::set, "consume");

            assertEquals(4, doubled.apply(2));
            assertEquals("ok", supplier.get());
            consumer.accept("v");
            assertEquals("v", seen.get());
            verifyNoInteractions(onError);
        }

        @Test
        @DisplayName("回调自身抛异常不应逃逸")
        void callbackFailureShouldNotEscape() {
            ErrorBoundary failing = new ErrorBoundary(PLUGIN_ID, (error, pluginId) -> {
                throw new RuntimeException("callback broke");
            });

            Runnable wrapped = failing.wrap(() -> {
                throw new IllegalStateException("x");
            }, "ctx");

            assertDoesNotThrow(wrapped::run);
        }

        @Test
        @DisplayName("没有回调时也不应抛异常")
        void noCallbackShouldStillContain() {
            ErrorBoundary bare = new ErrorBoundary(PLUGIN_ID);

            assertDoesNotThrow(() -> bare.wrap(() -> {
                throw new IllegalStateException("x");
            }).run());
        }

        @Test
        @DisplayName("每次调用相互独立")
        void eachCallIsIndependent() {
            Runnable wrapped = boundary.wrap(() -> {
                throw new IllegalStateException("x");
            }, "repeat");

            wrapped.run();
            wrapped.run();
            wrapped.run();

            verify(onError, times(3)).onError(any(), eq(PLUGIN_ID));
        }
    }

    @Nested
    @DisplayName("异步函数")
    class AsyncTests {

        @Test
        @DisplayName("异步失败应回调一次并以同一异常失败")
        void asyncFailureShouldBeReportedAndRethrown() {
            IllegalStateException failure = new IllegalStateException("y");
            Supplier<CompletableFuture<Object>> wrapped =
                    boundary.wrapAsync(() -> CompletableFuture.supplyAsync(() -> {
                        throw failure;
                    }), "async");

            CompletableFuture<Object> result = wrapped.get();

            ExecutionException thrown = assertThrows(ExecutionException.class,
                    () -> result.get(5, TimeUnit.SECONDS));
            assertSame(failure, thrown.getCause());
            assertEquals("y", thrown.getCause().getMessage());
            verify(onError, times(1)).onError(same(failure), eq(PLUGIN_ID));
        }

        @Test
        @DisplayName("已失败的 future 同样适用")
        void failedFutureShouldBeRethrown() {
            Supplier<CompletableFuture<String>> wrapped =
                    boundary.wrapAsync(() -> CompletableFuture.failedFuture(new RuntimeException("y")));

            CompletionExceptionHolder holder = new CompletionExceptionHolder();
            wrapped.get().whenComplete((v, e) -> holder.error = e);

            assertNotNull(holder.error);
            assertEquals("y", holder.error.getMessage());
            verify(onError, times(1)).onError(any(RuntimeException.class), eq(PLUGIN_ID));
        }

        @Test
        @DisplayName("异步成功应透传结果")
        void asyncSuccessShouldPassThrough() throws Exception {
            Function<Integer, CompletableFuture<Integer>> wrapped =
                    boundary.wrapAsyncFunction(i -> CompletableFuture.completedFuture(i + 1), "inc");

            assertEquals(2, wrapped.apply(1).get(5, TimeUnit.SECONDS));
            verifyNoInteractions(onError);
        }

        @Test
        @DisplayName("返回 future 之前的同步异常按同步规则处理")
        void syncThrowBeforeFutureShouldBeSwallowed() throws Exception {
            AtomicInteger calls = new AtomicInteger();
            Supplier<CompletableFuture<String>> wrapped = boundary.wrapAsync(() -> {
                calls.incrementAndGet();
                throw new IllegalStateException("early");
            }, "early");

            CompletableFuture<String> result = wrapped.get();

            assertEquals(1, calls.get());
            assertNull(result.get(5, TimeUnit.SECONDS));
            verify(onError, times(1)).onError(any(IllegalStateException.class), eq(PLUGIN_ID));
        }
    }

    private static final class CompletionExceptionHolder {
        Throwable error;
    }
}
