package com.acrescrypto.assetfs.exceptions;

import java.io.IOException;

public class EACCESException extends IOException {
	protected String path;

	public EACCESException(String path) {
		super("Access error: " + path);
		this.path = path;
	}
	
	/**
	 * 
	 */
	private static final long serialVersionUID = 878369340597612236L;

	public String getPath() {
		return path;
	}
}
