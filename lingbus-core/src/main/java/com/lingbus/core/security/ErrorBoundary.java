package com.lingbus.core.security;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * 插件错误边界
 * <p>
 * 包装插件提供的函数，使其故障不会逃逸到派发循环：
 * <ul>
 *     <li>同步异常：记录日志、通知回调，包装后的调用返回 null</li>
 *     <li>异步失败：记录日志、通知回调一次，然后把同一个异常交还给调用方</li>
 * </ul>
 * 插件抛出的 Error（如 AssertionError）同样被拦截，只有 VirtualMachineError 原样抛出。
 * 边界不保留历史，每次调用相互独立。
 */
@Slf4j
public class ErrorBoundary {

    @Getter
    private final String pluginId;
    private final ErrorCallback onError;

    public ErrorBoundary(String pluginId) {
        this(pluginId, null);
    }

    public ErrorBoundary(String pluginId, ErrorCallback onError) {
        this.pluginId = pluginId;
        this.onError = onError;
    }

    public Runnable wrap(Runnable fn) {
        return wrap(fn, null);
    }

    public Runnable wrap(Runnable fn, String context) {
        return () -> {
            try {
                fn.run();
            } catch (VirtualMachineError fatal) {
                throw fatal;
            } catch (Throwable e) {
                handleError(e, context);
            }
        };
    }

    public <T> Consumer<T> wrapConsumer(Consumer<T> fn, String context) {
        return arg -> {
            try {
                fn.accept(arg);
            } catch (VirtualMachineError fatal) {
                throw fatal;
            } catch (Throwable e) {
                handleError(e, context);
            }
        };
    }

    public <T, R> Function<T, R> wrapFunction(Function<T, R> fn, String context) {
        return arg -> {
            try {
                return fn.apply(arg);
            } catch (VirtualMachineError fatal) {
                throw fatal;
            } catch (Throwable e) {
                handleError(e, context);
                return null;
            }
        };
    }

    public <R> Supplier<R> wrapSupplier(Supplier<R> fn, String context) {
        return () -> {
            try {
                return fn.get();
            } catch (VirtualMachineError fatal) {
                throw fatal;
            } catch (Throwable e) {
                handleError(e, context);
                return null;
            }
        };
    }

    public <R> Supplier<CompletableFuture<R>> wrapAsync(Supplier<? extends CompletionStage<R>> fn) {
        return wrapAsync(fn, null);
    }

    /**
     * 包装异步函数
     * <p>
     * 返回的 future 以原始异常失败（不会再包一层 CompletionException），
     * 调用方 get/join 时仍能看到失败。函数在返回 future 之前同步抛出的异常按同步规则吞掉，
     * 此时返回一个以 null 完成的 future。
     */
    public <R> Supplier<CompletableFuture<R>> wrapAsync(Supplier<? extends CompletionStage<R>> fn, String context) {
        return () -> {
            CompletionStage<R> stage;
            try {
                stage = fn.get();
            } catch (VirtualMachineError fatal) {
                throw fatal;
            } catch (Throwable e) {
                handleError(e, context);
                return CompletableFuture.completedFuture(null);
            }
            return relay(stage, context);
        };
    }

    public <T, R> Function<T, CompletableFuture<R>> wrapAsyncFunction(
            Function<T, ? extends CompletionStage<R>> fn, String context) {
        return arg -> {
            CompletionStage<R> stage;
            try {
                stage = fn.apply(arg);
            } catch (VirtualMachineError fatal) {
                throw fatal;
            } catch (Throwable e) {
                handleError(e, context);
                return CompletableFuture.completedFuture(null);
            }
            return relay(stage, context);
        };
    }

    private <R> CompletableFuture<R> relay(CompletionStage<R> stage, String context) {
        CompletableFuture<R> result = new CompletableFuture<>();
        if (stage == null) {
            result.complete(null);
            return result;
        }
        stage.whenComplete((value, failure) -> {
            if (failure == null) {
                result.complete(value);
                return;
            }
            Throwable cause = unwrap(failure);
            handleError(cause, context);
            result.completeExceptionally(cause);
        });
        return result;
    }

    private void handleError(Throwable error, String context) {
        CapturedError captured = new CapturedError(pluginId, context, error);
        log.error(captured.describe());

        if (onError == null) {
            return;
        }
        try {
            onError.onCaptured(captured);
        } catch (Exception callbackError) {
            log.error("[Plugin {}] Error in error callback: {}", pluginId, callbackError.getMessage(), callbackError);
        }
    }

    private static Throwable unwrap(Throwable failure) {
        if ((failure instanceof CompletionException || failure instanceof ExecutionException)
                && failure.getCause() != null) {
            return failure.getCause();
        }
        return failure;
    }
}
