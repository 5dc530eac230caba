package com.example.assertdiff.domain;

import java.util.Objects;

/**
 * Per-call state of a message writer: idle, or rendering a value pair whose
 * types need to be spelled out.
 */
public final class RenderState {
    private static final RenderState IDLE = new RenderState(null);

    private final TypeNamePair typeNames;

    private RenderState(TypeNamePair typeNames) {
        this.typeNames = typeNames;
    }

    public static RenderState idle() {
        return IDLE;
    }

    public static RenderState rendering(TypeNamePair typeNames) {
        return new RenderState(Objects.requireNonNull(typeNames, "typeNames"));
    }

    public boolean isRendering() {
        return typeNames != null;
    }

    public String expectedTypeLabel() {
        return typeNames != null ? typeNames.expectedLabel() : "";
    }

    public String actualTypeLabel() {
        return typeNames != null ? typeNames.actualLabel() : "";
    }

    @Override
    public String toString() {
        return isRendering() ? "Rendering" + typeNames : "Idle";
    }
}
