package com.text2sql.llm;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.text2sql.config.Text2SqlProperties;
import com.text2sql.model.RequestContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class CredentialResolverTest {

    private Text2SqlProperties properties;

    @BeforeEach
    void setUp() {
        properties = new Text2SqlProperties();
        Text2SqlProperties.Customer acme = new Text2SqlProperties.Customer();
        acme.setApiKey("sk-acme");
        properties.getCustomers().put("acme", acme);
        properties.getCustomers().put("globex", new Text2SqlProperties.Customer());
    }

    @Test
    void resolve_shouldPreferCustomerKey() {
        CredentialResolver resolver = new CredentialResolver(properties, settings("sk-global"));

        RequestContext context = resolver.resolve(" acme ");

        assertEquals("acme", context.customerId());
        assertEquals("sk-acme", context.apiKey());
    }

    @Test
    void resolve_shouldFallBackToGlobalKey() {
        CredentialResolver resolver = new CredentialResolver(properties, settings("sk-global"));

        assertEquals("sk-global", resolver.resolve("globex").apiKey());
        assertEquals("sk-global", resolver.resolve("unknown").apiKey());

        RequestContext anonymous = resolver.resolve(null);
        assertNull(anonymous.customerId());
        assertEquals("sk-global", anonymous.apiKey());
    }

    @Test
    void resolve_shouldFailWithoutAnyKey() {
        CredentialResolver resolver = new CredentialResolver(properties, settings(null));

        assertThrows(ConfigurationException.class, () -> resolver.resolve("globex"));
        assertEquals("sk-acme", resolver.resolve("acme").apiKey());
    }

    private static CompletionSettings settings(String apiKey) {
        return new CompletionSettings("http://localhost", apiKey, "gpt-4o", "gpt-4", "gpt-3.5-turbo", 1000);
    }
}
