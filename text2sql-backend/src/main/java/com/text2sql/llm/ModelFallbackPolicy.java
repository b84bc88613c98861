package com.text2sql.llm;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Ordered list of models tried for one completion call; the first success wins.
 *
 * @param models model identifiers in the order they are tried
 */
public record ModelFallbackPolicy(List<String> models) {

    private static final Logger log = LoggerFactory.getLogger(ModelFallbackPolicy.class);

    public ModelFallbackPolicy {
        if (models == null || models.isEmpty()) {
            throw new IllegalArgumentException("At least one model is required");
        }
        models = List.copyOf(models);
    }

    /**
     * Primary model followed by a fallback. The fallback is dropped when blank or equal to the
     * primary model.
     *
     * @param primary primary model
     * @param fallback fallback model
     * @return policy
     */
    public static ModelFallbackPolicy of(String primary, String fallback) {
        List<String> models = new ArrayList<>(2);
        models.add(primary);
        if (fallback != null && !fallback.isBlank() && !fallback.equals(primary)) {
            models.add(fallback);
        }
        return new ModelFallbackPolicy(models);
    }

    /**
     * Run a call against each model in order until one succeeds.
     *
     * @param call the call to run for a given model
     * @param <T> call result type
     * @return result of the first successful call
     * @throws CompletionException the last failure when every model failed
     */
    public <T> T execute(ModelCall<T> call) throws CompletionException {
        CompletionException last = null;
        for (String model : models) {
            try {
                return call.apply(model);
            } catch (CompletionException e) {
                log.warn("Completion call failed (model={}): {}", model, e.getMessage());
                last = e;
            }
        }
        throw last;
    }

    /**
     * A completion call parameterized by model.
     *
     * @param <T> result type
     */
    @FunctionalInterface
    public interface ModelCall<T> {
        T apply(String model) throws CompletionException;
    }
}
