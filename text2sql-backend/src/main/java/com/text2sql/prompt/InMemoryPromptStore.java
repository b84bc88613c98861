package com.text2sql.prompt;

import com.text2sql.config.Text2SqlProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Prompt store kept in memory and seeded from {@code text2sql.prompts} and
 * {@code text2sql.customers.<id>.prompts}.
 *
 * <p>Global defaults for every {@link PromptRole} are stored at startup unless configuration already
 * provides them.
 */
@Slf4j
@Service
public class InMemoryPromptStore implements PromptStore {

    private final Map<String, String> defaults = new ConcurrentHashMap<>();
    private final Map<String, Map<String, String>> customerPrompts = new ConcurrentHashMap<>();
    private final Map<String, Map<String, String>> customerSettings;

    /**
     * Create a store seeded from configuration.
     *
     * @param properties application settings
     */
    public InMemoryPromptStore(Text2SqlProperties properties) {
        for (PromptRole role : PromptRole.values()) {
            defaults.put(role.getPromptId(), role.getDefaultText());
        }
        properties.getPrompts().forEach((id, text) -> {
            if (text != null && !text.isBlank()) {
                defaults.put(id, text);
            }
        });

        Map<String, Map<String, String>> settings = new LinkedHashMap<>();
        properties.getCustomers().forEach((customerId, customer) -> {
            Map<String, String> prompts = new LinkedHashMap<>();
            customer.getPrompts().forEach((id, text) -> {
                if (text != null && !text.isBlank()) {
                    prompts.put(id, text);
                }
            });
            settings.put(customerId, Map.copyOf(prompts));
        });
        this.customerSettings = Map.copyOf(settings);

        log.info("Prompt store initialized (default_prompts={}, customers_with_settings={})",
                defaults.size(), customerSettings.size());
    }

    @Override
    public Optional<String> findCustomerSetting(String customerId, String promptId) {
        if (customerId == null || promptId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(customerSettings.getOrDefault(customerId, Map.of()).get(promptId));
    }

    @Override
    public Optional<String> findPrompt(String promptId, String customerId) {
        if (promptId == null) {
            return Optional.empty();
        }
        if (customerId != null && !customerId.isBlank()) {
            String customerPrompt = customerPrompts.getOrDefault(customerId, Map.of()).get(promptId);
            if (customerPrompt != null) {
                log.debug("Found customer-specific prompt (prompt_id={}, customer_id={})", promptId, customerId);
                return Optional.of(customerPrompt);
            }
        }
        return Optional.ofNullable(defaults.get(promptId));
    }

    @Override
    public boolean upsert(String promptId, String promptText, String customerId) {
        if (promptId == null || promptId.isBlank() || promptText == null) {
            throw new IllegalArgumentException("prompt_id and prompt_text are required");
        }

        String previous;
        if (customerId != null && !customerId.isBlank()) {
            previous = customerPrompts.computeIfAbsent(customerId, k -> new ConcurrentHashMap<>()).put(promptId, promptText);
        } else {
            previous = defaults.put(promptId, promptText);
        }

        boolean changed = !Objects.equals(previous, promptText);
        if (changed) {
            log.info("Prompt created or updated (prompt_id={}, customer_id={})", promptId, customerId);
        }
        return changed;
    }

    @Override
    public Map<String, String> listForCustomer(String customerId) {
        Map<String, String> out = new LinkedHashMap<>(defaults);
        if (customerId != null) {
            out.putAll(customerPrompts.getOrDefault(customerId, Map.of()));
        }
        return out;
    }

    @Override
    public Map<String, Object> describe() {
        List<Map<String, String>> defaultPrompts = new ArrayList<>();
        for (String promptId : defaults.keySet()) {
            Map<String, String> item = new LinkedHashMap<>();
            item.put("prompt_id", promptId);
            for (PromptRole role : PromptRole.values()) {
                if (role.getPromptId().equals(promptId)) {
                    item.put("description", role.getDescription());
                }
            }
            defaultPrompts.add(item);
        }

        Map<String, Integer> counts = new LinkedHashMap<>();
        customerPrompts.forEach((customerId, prompts) -> counts.put(customerId, prompts.size()));

        Map<String, Object> out = new LinkedHashMap<>();
        out.put("default_prompts", defaultPrompts);
        out.put("customer_prompts", counts);
        return out;
    }
}
