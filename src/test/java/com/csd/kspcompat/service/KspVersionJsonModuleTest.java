package com.csd.kspcompat.service;

import com.csd.kspcompat.model.KspVersion;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class KspVersionJsonModuleTest {

    public static class ModMetadata {
        public String name;
        public KspVersion kspVersion;
    }

    private KspVersionService service;
    private ObjectMapper mapper;

    @BeforeEach
    void setUp() {
        service = new KspVersionService(new VersionCache());
        mapper = new ObjectMapper().registerModule(new KspVersionJsonModule(service));
    }

    @Test
    void writesCanonicalString() throws Exception {
        assertEquals("\"0.25.2\"", mapper.writeValueAsString(service.parse("0.25.2")));
        assertEquals("\"0.5\"", mapper.writeValueAsString(service.parse(".5")));
        assertEquals("\"any\"", mapper.writeValueAsString(KspVersion.any()));
    }

    @Test
    void readsThroughParse() throws Exception {
        assertEquals(service.parse("1.2.3"), mapper.readValue("\"1.2.3\"", KspVersion.class));
        assertEquals("0.5", mapper.readValue("\".5\"", KspVersion.class).toString());
        assertTrue(mapper.readValue("\"any\"", KspVersion.class).isAny());
    }

    @Test
    void roundTripsInsideDocument() throws Exception {
        ModMetadata mod = mapper.readValue("{\"name\":\"MechJeb\",\"kspVersion\":\"0.25\"}", ModMetadata.class);
        assertTrue(mod.kspVersion.isShort());
        assertEquals("{\"name\":\"MechJeb\",\"kspVersion\":\"0.25\"}", mapper.writeValueAsString(mod));
    }

    @Test
    void nullReadsAsWildcard() throws Exception {
        ModMetadata mod = mapper.readValue("{\"name\":\"MechJeb\",\"kspVersion\":null}", ModMetadata.class);
        assertTrue(mod.kspVersion.isAny());
    }

    @Test
    void malformedVersionFailsMapping() {
        assertThrows(JsonMappingException.class, () -> mapper.readValue("\"abc\"", KspVersion.class));
        assertThrows(JsonMappingException.class, () -> mapper.readValue("{\"kspVersion\":[1]}", ModMetadata.class));
    }
}
