package ru.r2cloud.utapi;

public class FileAccess {

	private String ufsUrl;
	private String url;

	public String getUfsUrl() {
		return ufsUrl;
	}

	public void setUfsUrl(String ufsUrl) {
		this.ufsUrl = ufsUrl;
	}

	/**
	 * Legacy url kept by the provider for older clients. Prefer
	 * {@link #getUfsUrl()}
	 */
	public String getUrl() {
		return url;
	}

	public void setUrl(String url) {
		this.url = url;
	}

}
