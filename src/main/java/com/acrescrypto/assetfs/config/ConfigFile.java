package com.acrescrypto.assetfs.config;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

import javax.json.Json;
import javax.json.JsonException;
import javax.json.JsonNumber;
import javax.json.JsonObject;
import javax.json.JsonObjectBuilder;
import javax.json.JsonReader;
import javax.json.JsonString;
import javax.json.JsonValue;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.acrescrypto.assetfs.exceptions.ENOENTException;
import com.acrescrypto.assetfs.fs.FS;

/** Flat JSON settings file. Values that were never set fall back to registered defaults.
 *
 * A ConfigFile constructed with storage saves itself after every set() and loads whatever is already at its path;
 * one constructed without storage lives only in memory. */
public class ConfigFile {
	protected final TreeMap<String,JsonValue> values = new TreeMap<>();
	protected final HashMap<String,Object> defaults = new HashMap<>();
	protected FS storage;
	protected String path;
	protected boolean autosave = true;

	private Logger logger = LoggerFactory.getLogger(ConfigFile.class);

	public ConfigFile() {
	}

	public ConfigFile(FS storage, String path) throws IOException {
		this.storage = storage;
		this.path = path;

		try {
			load();
			logger.info("Config: loaded {} settings from {}", values.size(), path);
		} catch(ENOENTException exc) {
			logger.info("Config: no settings file at {}, using defaults", path);
		}
	}

	public String getPath() {
		return path;
	}

	public synchronized void load() throws IOException {
		if(storage == null) return;
		byte[] serialized = storage.read(path);

		JsonObject json;
		try(JsonReader reader = Json.createReader(new ByteArrayInputStream(serialized))) {
			json = reader.readObject();
		} catch(JsonException exc) {
			throw new IOException(path + ": not a JSON object", exc);
		}

		values.clear();
		values.putAll(json);
	}

	public synchronized void save() throws IOException {
		if(storage == null) return;
		storage.write(path, toJson().toString().getBytes(StandardCharsets.UTF_8));
	}

	public synchronized JsonObject toJson() {
		JsonObjectBuilder builder = Json.createObjectBuilder();
		values.forEach(builder::add);
		return builder.build();
	}

	public void setAutosave(boolean autosave) {
		this.autosave = autosave;
	}

	public synchronized void set(String key, JsonValue value) {
		logger.debug("Config: {} = {}", key, value);
		values.put(key, value);
		if(!autosave) return;

		try {
			save();
		} catch(IOException exc) {
			logger.error("Config: unable to save {} after setting {}", path, key, exc);
		}
	}

	public void set(String key, boolean value) {
		set(key, value ? JsonValue.TRUE : JsonValue.FALSE);
	}

	public void set(String key, int value) {
		set(key, Json.createValue(value));
	}

	public void set(String key, long value) {
		set(key, Json.createValue(value));
	}

	public void set(String key, String value) {
		set(key, Json.createValue(value));
	}

	public synchronized void setDefault(String key, Object value) {
		defaults.put(key, value);
	}

	/** True only for explicitly set keys; defaults do not count. */
	public synchronized boolean isSet(String key) {
		return values.containsKey(key);
	}

	public synchronized void unset(String key) {
		values.remove(key);
	}

	public synchronized boolean getBool(String key) {
		JsonValue value = values.get(key);
		if(value == null) return Boolean.TRUE.equals(defaults.get(key));
		return value.getValueType() == JsonValue.ValueType.TRUE;
	}

	public int getInt(String key) {
		return (int) getLong(key);
	}

	public synchronized long getLong(String key) {
		JsonValue value = values.get(key);
		if(value instanceof JsonNumber) return ((JsonNumber) value).longValue();
		if(value != null) throw new IllegalArgumentException(key + " is not a number: " + value);

		Object fallback = defaults.get(key);
		if(fallback == null) return 0;
		if(fallback instanceof Number) return ((Number) fallback).longValue();
		throw new IllegalArgumentException(key + " has a non-numeric default: " + fallback);
	}

	public synchronized String getString(String key) {
		JsonValue value = values.get(key);
		if(value instanceof JsonString) return ((JsonString) value).getString();
		if(value != null) return value.toString();

		Object fallback = defaults.get(key);
		return fallback == null ? null : fallback.toString();
	}

	/** Every key with a value or a default. */
	public synchronized Set<String> keys() {
		TreeSet<String> keys = new TreeSet<>(defaults.keySet());
		keys.addAll(values.keySet());
		return keys;
	}

	/** Effective settings as plain Java values, sorted by key. */
	public synchronized Map<String,Object> asMap() {
		TreeMap<String,Object> map = new TreeMap<>();
		for(String key : keys()) {
			JsonValue value = values.get(key);
			if(value == null) {
				map.put(key, defaults.get(key));
				continue;
			}

			switch(value.getValueType()) {
			case STRING:
				map.put(key, ((JsonString) value).getString());
				break;
			case NUMBER:
				map.put(key, ((JsonNumber) value).longValue());
				break;
			case TRUE:
				map.put(key, true);
				break;
			case FALSE:
				map.put(key, false);
				break;
			default:
				map.put(key, value.toString());
			}
		}

		return Collections.unmodifiableMap(map);
	}
}
