package com.reliquary.data;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import com.google.gson.stream.JsonWriter;
import com.reliquary.model.LocationKind;
import com.reliquary.model.Lock;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Centralized factory for creating Gson instances with the randomizer's
 * TypeAdapters registered.
 *
 * <p>Locks are written as plain token arrays ({@code ["L", "B"]}) and location
 * kinds as lower-case names ({@code "guarded"}), matching the catalog
 * resource.
 */
public final class GsonFactory {

    private GsonFactory() {
        // Utility class - prevent instantiation
    }

    public static Gson create() {
        return builder().create();
    }

    /**
     * Get a GsonBuilder pre-configured with the randomizer TypeAdapters.
     * Use this when you need additional customization.
     */
    public static GsonBuilder builder() {
        return new GsonBuilder()
                .disableHtmlEscaping()
                .registerTypeAdapter(Lock.class, new LockAdapter())
                .registerTypeAdapter(LocationKind.class, new LowerCaseEnumAdapter<>(LocationKind.class));
    }

    /**
     * {@link Lock} as a JSON array of tokens. Example: {@code ["L", "B"]}
     */
    private static class LockAdapter extends TypeAdapter<Lock> {
        @Override
        public void write(JsonWriter out, Lock value) throws IOException {
            if (value == null) {
                out.nullValue();
                return;
            }
            out.beginArray();
            for (String token : value.tokens()) {
                out.value(token);
            }
            out.endArray();
        }

        @Override
        public Lock read(JsonReader in) throws IOException {
            if (in.peek() == JsonToken.NULL) {
                in.nextNull();
                return null;
            }
            List<String> tokens = new ArrayList<>();
            in.beginArray();
            while (in.hasNext()) {
                tokens.add(in.nextString());
            }
            in.endArray();
            return Lock.of(tokens);
        }
    }

    /**
     * Enum constants as lower-case names. Example: {@code "equipment"}
     */
    private static class LowerCaseEnumAdapter<E extends Enum<E>> extends TypeAdapter<E> {
        private final Class<E> type;

        LowerCaseEnumAdapter(Class<E> type) {
            this.type = type;
        }

        @Override
        public void write(JsonWriter out, E value) throws IOException {
            if (value == null) {
                out.nullValue();
            } else {
                out.value(value.name().toLowerCase(Locale.ROOT));
            }
        }

        @Override
        public E read(JsonReader in) throws IOException {
            if (in.peek() == JsonToken.NULL) {
                in.nextNull();
                return null;
            }
            String name = in.nextString();
            try {
                return Enum.valueOf(type, name.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new JsonParseException("Unknown " + type.getSimpleName() + ": " + name, e);
            }
        }
    }
}
