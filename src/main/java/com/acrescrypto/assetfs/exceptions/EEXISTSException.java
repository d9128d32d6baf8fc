package com.acrescrypto.assetfs.exceptions;

import java.io.IOException;

public class EEXISTSException extends IOException {
	protected String path;

	public EEXISTSException(String path) {
		super("Path exists: " + path);
		this.path = path;
	}

	/**
	 * 
	 */
	private static final long serialVersionUID = 2775322692425591861L;

	public String getPath() {
		return path;
	}
}
