package com.acrescrypto.assetfs.config;

import java.io.IOException;

import com.acrescrypto.assetfs.fs.FS;

/** Process-wide settings consulted by the archive code. Starts out as the built-in defaults; loadFrom() swaps in
 * a settings file whose explicit values override them. */
public class ConfigDefaults {
	public final static String COPY_BUFFER_SIZE = "fs.archive.copyBufferSize";
	public final static String DEFAULT_VERSION = "fs.archive.defaultVersion";
	public final static String SCRATCH_DIR = "fs.archive.scratchDir";
	public final static String WORKER_THREADS = "fs.archive.workerThreads";

	protected static ConfigFile activeDefaults;

	public static synchronized ConfigFile getActiveDefaults() {
		if(activeDefaults == null) {
			resetDefaults();
		}

		return activeDefaults;
	}

	public static synchronized void resetDefaults() {
		activeDefaults = new ConfigFile();
		registerBaseDefaults(activeDefaults);
	}

	/** Use the settings file at path on fs, creating nothing if it is absent. Later set() calls save to it. */
	public static synchronized ConfigFile loadFrom(FS fs, String path) throws IOException {
		ConfigFile config = new ConfigFile(fs, path);
		registerBaseDefaults(config);
		activeDefaults = config;
		return config;
	}

	public static void registerBaseDefaults(ConfigFile config) {
		config.setDefault(COPY_BUFFER_SIZE,  64*1024);
		config.setDefault(DEFAULT_VERSION,         3);
		config.setDefault(SCRATCH_DIR,    System.getProperty("java.io.tmpdir"));
		config.setDefault(WORKER_THREADS,          2);
	}

	private ConfigDefaults() {
	}
}
