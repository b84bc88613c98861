package com.text2sql.llm;

import com.text2sql.config.Text2SqlProperties;
import com.text2sql.model.RequestContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Builds the {@link RequestContext} of a request: the customer scope and the API key that applies to
 * it.
 *
 * <p>A customer-specific key wins over the global key.
 */
@Slf4j
@Component
public class CredentialResolver {

    private final Text2SqlProperties properties;
    private final CompletionSettings settings;

    public CredentialResolver(Text2SqlProperties properties, CompletionSettings settings) {
        this.properties = properties;
        this.settings = settings;
    }

    /**
     * Resolve the request scope.
     *
     * @param customerId optional customer id
     * @return request context
     * @throws ConfigurationException when neither a customer nor a global key is available
     */
    public RequestContext resolve(String customerId) {
        String scope = customerId != null && !customerId.isBlank() ? customerId.trim() : null;

        if (scope != null) {
            Text2SqlProperties.Customer customer = properties.getCustomers().get(scope);
            if (customer != null && customer.getApiKey() != null && !customer.getApiKey().isBlank()) {
                log.debug("Using customer-specific completion API key (customer_id={})", scope);
                return new RequestContext(scope, customer.getApiKey().trim());
            }
        }

        if (settings.hasApiKey()) {
            return new RequestContext(scope, settings.apiKey());
        }

        log.error("Completion API key is missing from all sources (customer_id={})", scope);
        throw new ConfigurationException("Completion API key is required but none is configured"
                + (scope != null ? " for customer " + scope : ""));
    }
}
