package com.text2sql.llm;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class ModelFallbackPolicyTest {

    @Test
    void of_shouldDropBlankOrDuplicateFallback() {
        assertEquals(List.of("gpt-4o", "gpt-4"), ModelFallbackPolicy.of("gpt-4o", "gpt-4").models());
        assertEquals(List.of("gpt-4o"), ModelFallbackPolicy.of("gpt-4o", "gpt-4o").models());
        assertEquals(List.of("gpt-4o"), ModelFallbackPolicy.of("gpt-4o", " ").models());
        assertEquals(List.of("gpt-4o"), ModelFallbackPolicy.of("gpt-4o", null).models());
    }

    @Test
    void constructor_shouldRequireAtLeastOneModel() {
        assertThrows(IllegalArgumentException.class, () -> new ModelFallbackPolicy(List.of()));
    }

    @Test
    void execute_shouldStopAtFirstSuccess() throws Exception {
        List<String> tried = new ArrayList<>();

        String result = ModelFallbackPolicy.of("a", "b").execute(model -> {
            tried.add(model);
            return "ok:" + model;
        });

        assertEquals("ok:a", result);
        assertEquals(List.of("a"), tried);
    }

    @Test
    void execute_shouldFallBackInOrder() throws Exception {
        List<String> tried = new ArrayList<>();

        String result = ModelFallbackPolicy.of("a", "b").execute(model -> {
            tried.add(model);
            if ("a".equals(model)) {
                throw new CompletionException("a failed");
            }
            return "ok:" + model;
        });

        assertEquals("ok:b", result);
        assertEquals(List.of("a", "b"), tried);
    }

    @Test
    void execute_shouldRethrowLastFailure() {
        CompletionException ex = assertThrows(CompletionException.class,
                () -> ModelFallbackPolicy.of("a", "b").execute(model -> {
                    throw new CompletionException(model + " failed");
                }));

        assertEquals("b failed", ex.getMessage());
    }
}
