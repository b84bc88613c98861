package com.text2sql.prompt;

import java.util.Map;
import java.util.Optional;

/**
 * Role-keyed, optionally customer-scoped prompt text store.
 */
public interface PromptStore {

    /**
     * Prompt from the customer's own prompt settings.
     *
     * @param customerId customer id
     * @param promptId prompt id
     * @return prompt text if configured
     */
    Optional<String> findCustomerSetting(String customerId, String promptId);

    /**
     * Named prompt document: the customer-specific one when {@code customerId} is given and exists,
     * otherwise the global default.
     *
     * @param promptId prompt id
     * @param customerId customer id, may be null
     * @return prompt text if stored
     */
    Optional<String> findPrompt(String promptId, String customerId);

    /**
     * Create or replace a prompt document.
     *
     * @param promptId prompt id
     * @param promptText prompt text
     * @param customerId owning customer, or null for a global default
     * @return true when the stored text changed
     */
    boolean upsert(String promptId, String promptText, String customerId);

    /**
     * All prompts visible to a customer, customer documents overriding defaults.
     *
     * @param customerId customer id
     * @return prompt id to text
     */
    Map<String, String> listForCustomer(String customerId);

    /**
     * Overview of stored prompts: default prompt ids and per-customer document counts.
     *
     * @return description map
     */
    Map<String, Object> describe();
}
