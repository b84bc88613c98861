package com.text2sql.prompt;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.text2sql.config.Text2SqlProperties;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class InMemoryPromptStoreTest {

    private InMemoryPromptStore store;

    @BeforeEach
    void setUp() {
        Text2SqlProperties properties = new Text2SqlProperties();
        properties.getPrompts().put("result_summary_system_message", "Configured summary prompt");
        Text2SqlProperties.Customer acme = new Text2SqlProperties.Customer();
        acme.getPrompts().put("sql_system_message", "Acme generation prompt");
        properties.getCustomers().put("acme", acme);
        store = new InMemoryPromptStore(properties);
    }

    @Test
    void findPrompt_shouldSeedDefaultsFromRolesAndConfiguration() {
        assertEquals(Optional.of(PromptRole.GENERATION.getDefaultText()), store.findPrompt("sql_system_message", null));
        assertEquals(Optional.of("Configured summary prompt"), store.findPrompt("result_summary_system_message", null));
        assertTrue(store.findPrompt("unknown", null).isEmpty());
    }

    @Test
    void findCustomerSetting_shouldReadCustomerConfiguration() {
        assertEquals(Optional.of("Acme generation prompt"), store.findCustomerSetting("acme", "sql_system_message"));
        assertTrue(store.findCustomerSetting("acme", "sql_debug_system_message").isEmpty());
        assertTrue(store.findCustomerSetting("globex", "sql_system_message").isEmpty());
    }

    @Test
    void upsert_shouldStoreCustomerDocumentAndReportChanges() {
        assertTrue(store.upsert("sql_debug_system_message", "Acme debug", "acme"));
        assertFalse(store.upsert("sql_debug_system_message", "Acme debug", "acme"));

        assertEquals(Optional.of("Acme debug"), store.findPrompt("sql_debug_system_message", "acme"));
        assertEquals(Optional.of(PromptRole.DEBUG.getDefaultText()), store.findPrompt("sql_debug_system_message", "globex"));
    }

    @Test
    void upsert_shouldRejectMissingFields() {
        assertThrows(IllegalArgumentException.class, () -> store.upsert(" ", "text", null));
        assertThrows(IllegalArgumentException.class, () -> store.upsert("sql_system_message", null, null));
    }

    @Test
    void listForCustomer_shouldOverlayCustomerDocuments() {
        store.upsert("sql_debug_system_message", "Acme debug", "acme");

        Map<String, String> acme = store.listForCustomer("acme");
        Map<String, String> global = store.listForCustomer(null);

        assertEquals("Acme debug", acme.get("sql_debug_system_message"));
        assertEquals(PromptRole.DEBUG.getDefaultText(), global.get("sql_debug_system_message"));
        assertEquals(3, global.size());
    }

    @Test
    @SuppressWarnings("unchecked")
    void describe_shouldListDefaultsAndCustomerCounts() {
        store.upsert("sql_debug_system_message", "Acme debug", "acme");

        Map<String, Object> description = store.describe();

        List<Map<String, String>> defaults = (List<Map<String, String>>) description.get("default_prompts");
        assertEquals(3, defaults.size());
        assertTrue(defaults.stream().allMatch(item -> item.containsKey("description")));
        assertEquals(Map.of("acme", 1), description.get("customer_prompts"));
    }

    @Test
    void format_shouldReplacePlaceholdersLiterally() {
        String formatted = PromptRole.format("Schema: {schema}. Keep {braces} and {{x}}.", Map.of("schema", "{\"t\": 1}"));

        assertEquals("Schema: {\"t\": 1}. Keep {braces} and {{x}}.", formatted);
    }
}
