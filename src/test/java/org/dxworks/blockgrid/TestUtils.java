package org.dxworks.blockgrid;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.annotation.JsonInclude;
import org.dxworks.blockgrid.model.StructureBuilder;
import org.dxworks.blockgrid.model.TokenCatalog;

public class TestUtils {
    public static final ObjectMapper APPROVAL_MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    public static StructureBuilder structure() {
        return StructureBuilder.using(TokenCatalog.standard());
    }
}
