package com.parkthrive.crmops.paging;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.parkthrive.crmops.config.FatalConfigException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class QueryLoaderTest {

    private static final String COUNTING_QUERY = "{\"query\": {\"type\": \"and\", \"queries\": ["
            + "{\"type\": \"object_type\", \"object_type\": \"lead\"},"
            + "{\"type\": \"and\", \"queries\": [{\"type\": \"field_condition\","
            + "  \"field\": {\"type\": \"custom_field\", \"custom_field_id\": \"cf_owner\"},"
            + "  \"condition\": {\"type\": \"reference\", \"object_ids\": [\"user_old\"]}}]}]}}";

    @TempDir
    Path dir;

    private QueryLoader loader;

    @BeforeEach
    void setUp() {
        loader = new QueryLoader(new ObjectMapper());
    }

    @Test
    void testLoad_ReadsJsonObject() throws Exception {
        Path file = Files.writeString(dir.resolve("q.json"), "{\"limit\": 5}");

        assertThat(loader.load(file).get("limit").asInt()).isEqualTo(5);
    }

    @Test
    void testLoad_MissingFileIsFatal() {
        assertThatThrownBy(() -> loader.load(dir.resolve("nope.json")))
                .isInstanceOf(FatalConfigException.class)
                .hasMessageContaining("Query file not found");
    }

    @Test
    void testLoad_InvalidJsonIsFatal() throws Exception {
        Path file = Files.writeString(dir.resolve("bad.json"), "{\"query\": ");

        assertThatThrownBy(() -> loader.load(file)).isInstanceOf(FatalConfigException.class);
    }

    @Test
    void testLoad_ArrayIsFatal() throws Exception {
        Path file = Files.writeString(dir.resolve("array.json"), "[1, 2]");

        assertThatThrownBy(() -> loader.load(file)).isInstanceOf(FatalConfigException.class);
    }

    @Test
    void testWithDefaultLeadFields_OnlyWhenAbsent() throws Exception {
        ObjectNode bare = (ObjectNode) new ObjectMapper().readTree("{\"query\": {}}");
        ObjectNode withFields = (ObjectNode) new ObjectMapper().readTree("{\"_fields\": {\"lead\": [\"id\"]}}");

        ObjectNode defaulted = loader.withDefaultLeadFields(bare, List.of("id", "display_name", "opportunities"));

        assertThat(defaulted.path("_fields").path("lead")).hasSize(3);
        assertThat(bare.has("_fields")).isFalse();
        assertThat(loader.withDefaultLeadFields(withFields, List.of("id", "opportunities"))
                .path("_fields").path("lead")).hasSize(1);
    }

    @Test
    void testWithObjectIds_ReplacesNestedConditionOnCopy() throws Exception {
        ObjectNode query = (ObjectNode) new ObjectMapper().readTree(COUNTING_QUERY);

        ObjectNode rep = loader.withObjectIds(query, "cf_owner", "user_new");

        String replaced = rep.path("query").path("queries").get(1).path("queries").get(0)
                .path("condition").path("object_ids").toString();
        String original = query.path("query").path("queries").get(1).path("queries").get(0)
                .path("condition").path("object_ids").toString();
        assertThat(replaced).isEqualTo("[\"user_new\"]");
        assertThat(original).isEqualTo("[\"user_old\"]");
    }

    @Test
    void testWithObjectIds_UnknownFieldLeavesQueryUnchanged() throws Exception {
        ObjectNode query = (ObjectNode) new ObjectMapper().readTree(COUNTING_QUERY);

        assertThat(loader.withObjectIds(query, "cf_other", "user_new")).isEqualTo(query);
    }
}
