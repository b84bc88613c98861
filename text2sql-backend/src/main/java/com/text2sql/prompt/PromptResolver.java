package com.text2sql.prompt;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Resolves the instruction text for a pipeline role.
 *
 * <p>Lookup order: the customer's prompt settings, then the store's named prompt (customer document
 * before global default), then the built-in text of the role. Store failures are logged and skipped;
 * resolution always yields usable text.
 */
@Slf4j
@Component
public class PromptResolver {

    private final PromptStore promptStore;

    public PromptResolver(PromptStore promptStore) {
        this.promptStore = promptStore;
    }

    /**
     * Resolve the prompt text for a role.
     *
     * @param role pipeline role
     * @param customerId optional customer scope
     * @return prompt text, never blank
     */
    public String resolve(PromptRole role, String customerId) {
        String promptId = role.getPromptId();
        boolean scoped = customerId != null && !customerId.isBlank();

        if (scoped) {
            Optional<String> setting = lookup(() -> promptStore.findCustomerSetting(customerId, promptId), promptId);
            if (setting.isPresent()) {
                return setting.get();
            }
        }

        Optional<String> stored = lookup(() -> promptStore.findPrompt(promptId, scoped ? customerId : null), promptId);
        if (stored.isPresent()) {
            return stored.get();
        }

        log.warn("No stored prompt found, using built-in default (prompt_id={})", promptId);
        return role.getDefaultText();
    }

    private Optional<String> lookup(PromptLookup lookup, String promptId) {
        try {
            Optional<String> found = lookup.find();
            return found != null ? found.filter(text -> !text.isBlank()) : Optional.empty();
        } catch (RuntimeException e) {
            log.error("Prompt lookup failed (prompt_id={})", promptId, e);
            return Optional.empty();
        }
    }

    @FunctionalInterface
    private interface PromptLookup {
        Optional<String> find();
    }
}
