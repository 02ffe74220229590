package com.vmcaps.migration;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonIOException;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.StringWriter;
import java.io.Writer;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * JSON encoding of the capability sections of a migration stream.
 *
 * <pre>
 * {"formatVersion":1,"sections":[{"name":"cap/htm","version":1,"value":1}]}
 * </pre>
 */
public class MigrationStreamCodec {

    public static final int FORMAT_VERSION = 1;

    private final Gson gson;

    public MigrationStreamCodec() {
        this.gson = new GsonBuilder().create();
    }

    public void write(List<CapabilitySection> sections, Writer writer) throws IOException {
        JsonObject root = new JsonObject();
        root.addProperty("formatVersion", FORMAT_VERSION);
        JsonArray array = new JsonArray();
        for (CapabilitySection section : sections) {
            JsonObject entry = new JsonObject();
            entry.addProperty("name", section.name());
            entry.addProperty("version", section.version());
            entry.addProperty("value", section.value());
            array.add(entry);
        }
        root.add("sections", array);

        try {
            gson.toJson(root, writer);
            writer.flush();
        } catch (JsonIOException e) {
            throw new IOException("Failed to write capability sections", e);
        }
    }

    public String encode(List<CapabilitySection> sections) {
        StringWriter writer = new StringWriter();
        try {
            write(sections, writer);
        } catch (IOException e) {
            throw new IllegalStateException("StringWriter cannot fail", e);
        }
        return writer.toString();
    }

    /**
     * Reads capability sections.
     *
     * @throws MigrationStreamException if the document is malformed or has an unknown format version
     */
    public List<CapabilitySection> read(Reader reader) throws MigrationStreamException {
        JsonObject root;
        try {
            JsonElement element = JsonParser.parseReader(reader);
            if (!element.isJsonObject()) {
                throw new MigrationStreamException("Capability stream is not a JSON object");
            }
            root = element.getAsJsonObject();
        } catch (JsonParseException e) {
            throw new MigrationStreamException("Malformed capability stream: " + e.getMessage(), e);
        }

        if (!root.has("formatVersion")) {
            throw new MigrationStreamException("Capability stream has no formatVersion");
        }
        int formatVersion = intField(root, "formatVersion");
        if (formatVersion != FORMAT_VERSION) {
            throw new MigrationStreamException(String.format(
                "Unsupported capability stream format %d (expected %d)", formatVersion, FORMAT_VERSION));
        }

        List<CapabilitySection> sections = new ArrayList<>();
        JsonElement sectionsElement = root.get("sections");
        if (sectionsElement == null || sectionsElement.isJsonNull()) {
            return sections;
        }
        if (!sectionsElement.isJsonArray()) {
            throw new MigrationStreamException("Capability stream 'sections' is not an array");
        }
        for (JsonElement element : sectionsElement.getAsJsonArray()) {
            if (!element.isJsonObject()) {
                throw new MigrationStreamException("Capability section is not an object: " + element);
            }
            JsonObject entry = element.getAsJsonObject();
            if (!entry.has("name") || !entry.get("name").isJsonPrimitive()) {
                throw new MigrationStreamException("Capability section without name: " + entry);
            }
            sections.add(new CapabilitySection(
                entry.get("name").getAsString(), intField(entry, "version"), intField(entry, "value")));
        }
        return sections;
    }

    public List<CapabilitySection> decode(String json) throws MigrationStreamException {
        return read(new StringReader(json));
    }

    private static int intField(JsonObject object, String field) throws MigrationStreamException {
        JsonElement element = object.get(field);
        if (element == null || !element.isJsonPrimitive() || !element.getAsJsonPrimitive().isNumber()) {
            throw new MigrationStreamException("Field '" + field + "' is missing or not a number in " + object);
        }
        try {
            BigDecimal number = element.getAsBigDecimal();
            if (number.stripTrailingZeros().scale() > 0) {
                throw new MigrationStreamException("Field '" + field + "' is not an integer in " + object);
            }
            return number.intValueExact();
        } catch (NumberFormatException | ArithmeticException e) {
            throw new MigrationStreamException("Field '" + field + "' is not a valid integer in " + object, e);
        }
    }
}
