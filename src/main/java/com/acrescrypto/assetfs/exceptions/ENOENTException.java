package com.acrescrypto.assetfs.exceptions;

import java.io.IOException;

public class ENOENTException extends IOException {
	protected String path;

	public ENOENTException(String path) {
		super(path + ": no such file or directory");
		this.path = path;
	}

	/**
	 * 
	 */
	private static final long serialVersionUID = -8812124167099433790L;

	public String getPath() {
		return path;
	}
}
