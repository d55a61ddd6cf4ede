package org.astbridge.translation;

import lombok.Getter;

import java.util.Objects;

/**
 * 翻译器的配置：变量是否具体化，以及逐节点跟踪接收器。
 * 在翻译器构造时固定，整个生命周期内不变。此类是不可变的。
 */
@Getter
public final class TranslationOptions {

    private static final TranslationOptions SYMBOLIC = new TranslationOptions(false, TranslationTracer.NONE);
    private static final TranslationOptions CONCRETIZING = new TranslationOptions(true, TranslationTracer.NONE);

    /**
     * 为 true 时变量被替换为其当前具体值，否则保留为自由符号。
     */
    private final boolean concretize;

    private final TranslationTracer tracer;

    private TranslationOptions(boolean concretize, TranslationTracer tracer) {
        this.concretize = concretize;
        this.tracer = Objects.requireNonNull(tracer, "Tracer cannot be null.");
    }

    public static TranslationOptions symbolic() {
        return SYMBOLIC;
    }

    public static TranslationOptions concretizing() {
        return CONCRETIZING;
    }

    public static TranslationOptions of(boolean concretize) {
        return concretize ? CONCRETIZING : SYMBOLIC;
    }

    public TranslationOptions withTracer(TranslationTracer tracer) {
        return new TranslationOptions(concretize, tracer);
    }

    @Override
    public String toString() {
        return "TranslationOptions(concretize=" + concretize + ", tracer=" + tracer.getClass().getSimpleName() + ")";
    }
}
