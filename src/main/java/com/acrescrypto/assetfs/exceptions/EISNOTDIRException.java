package com.acrescrypto.assetfs.exceptions;

import java.io.IOException;

public class EISNOTDIRException extends IOException {
	protected String path;

	public EISNOTDIRException(String path) {
		super(path + ": is not a directory");
		this.path = path;
	}

	/**
	 * 
	 */
	private static final long serialVersionUID = -1103170400987572535L;

	public String getPath() {
		return path;
	}
}
