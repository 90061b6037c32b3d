package com.csd.kspcompat.service;

import com.csd.kspcompat.exception.BadKspVersionException;
import com.csd.kspcompat.model.KspVersion;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;

import java.io.IOException;

/**
 * Reads and writes {@link KspVersion} as a plain JSON string. The wildcard is written as
 * {@code "any"}; a JSON {@code null} reads back as the wildcard.
 */
public class KspVersionJsonModule extends SimpleModule {

    public KspVersionJsonModule(KspVersionService versionService) {
        super("KspVersionModule");
        addSerializer(KspVersion.class, new KspVersionSerializer());
        addDeserializer(KspVersion.class, new KspVersionDeserializer(versionService));
    }

    static class KspVersionSerializer extends StdSerializer<KspVersion> {

        KspVersionSerializer() {
            super(KspVersion.class);
        }

        @Override
        public void serialize(KspVersion value, JsonGenerator gen, SerializerProvider provider) throws IOException {
            gen.writeString(value.toString());
        }
    }

    static class KspVersionDeserializer extends StdDeserializer<KspVersion> {

        private final KspVersionService versionService;

        KspVersionDeserializer(KspVersionService versionService) {
            super(KspVersion.class);
            this.versionService = versionService;
        }

        @Override
        public KspVersion deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            String text = p.getValueAsString();
            if (text == null) {
                return (KspVersion) ctxt.handleUnexpectedToken(KspVersion.class, p);
            }
            try {
                return versionService.parse(text);
            } catch (BadKspVersionException e) {
                return (KspVersion) ctxt.handleWeirdStringValue(KspVersion.class, text, "%s", e.getMessage());
            }
        }

        @Override
        public KspVersion getNullValue(DeserializationContext ctxt) {
            return KspVersion.any();
        }
    }
}
