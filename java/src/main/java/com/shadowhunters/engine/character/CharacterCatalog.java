package com.shadowhunters.engine.character;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Character lookup by id, loaded from JSON.
 */
public class CharacterCatalog {
    private static final TypeReference<List<CharacterData>> LIST_TYPE = new TypeReference<>() {};

    private final Map<String, CharacterData> characters;

    private CharacterCatalog(Map<String, CharacterData> characters) {
        this.characters = characters;
    }

    public static CharacterCatalog fromFile(String path) throws CharacterCatalogException {
        try {
            return fromJson(Files.readString(Path.of(path)));
        } catch (IOException e) {
            throw new CharacterCatalogException("IO error: " + e.getMessage(), e);
        }
    }

    public static CharacterCatalog fromResource(String resourcePath) throws CharacterCatalogException {
        try (InputStream is = CharacterCatalog.class.getClassLoader().getResourceAsStream(resourcePath)) {
            if (is == null) {
                throw new CharacterCatalogException("Resource not found: " + resourcePath);
            }
            return fromList(new ObjectMapper().readValue(is, LIST_TYPE));
        } catch (IOException e) {
            throw new CharacterCatalogException("JSON parsing error: " + e.getMessage(), e);
        }
    }

    public static CharacterCatalog fromJson(String json) throws CharacterCatalogException {
        try {
            return fromList(new ObjectMapper().readValue(json, LIST_TYPE));
        } catch (IOException e) {
            throw new CharacterCatalogException("JSON parsing error: " + e.getMessage(), e);
        }
    }

    private static CharacterCatalog fromList(List<CharacterData> list) throws CharacterCatalogException {
        Map<String, CharacterData> characters = new LinkedHashMap<>();
        for (CharacterData data : list) {
            if (data.getKey() == null || data.getFaction() == null || data.getHp() <= 0) {
                throw new CharacterCatalogException("Incomplete character entry: " + data.getName());
            }
            if (characters.putIfAbsent(data.getKey(), data) != null) {
                throw new CharacterCatalogException("Duplicate character id: " + data.getKey());
            }
        }
        return new CharacterCatalog(characters);
    }

    /**
     * @throws CharacterCatalogException if no character has this id
     */
    public CharacterData get(String key) throws CharacterCatalogException {
        CharacterData data = characters.get(key);
        if (data == null) {
            throw new CharacterCatalogException("Character not found: " + key);
        }
        return data;
    }

    public boolean has(String key) {
        return characters.containsKey(key);
    }

    public List<CharacterData> byFaction(Faction faction) {
        List<CharacterData> result = new ArrayList<>();
        for (CharacterData data : characters.values()) {
            if (data.getFaction() == faction) {
                result.add(data);
            }
        }
        return result;
    }

    public List<CharacterData> all() {
        return List.copyOf(characters.values());
    }

    public int size() {
        return characters.size();
    }
}
