package ru.r2cloud.utapi;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Presigned S3-compatible POST issued by the provider. {@link #getFields()}
 * keeps the order returned by the provider.
 */
public class PresignedPost {

	private String key;
	private String fileName;
	private String fileType;
	private String fileUrl;
	private String contentDisposition;
	private String pollingJwt;
	private String pollingUrl;
	private String customId;
	private String url;
	private Map<String, String> fields = new LinkedHashMap<>();

	public String getKey() {
		return key;
	}

	public void setKey(String key) {
		this.key = key;
	}

	public String getFileName() {
		return fileName;
	}

	public void setFileName(String fileName) {
		this.fileName = fileName;
	}

	public String getFileType() {
		return fileType;
	}

	public void setFileType(String fileType) {
		this.fileType = fileType;
	}

	public String getFileUrl() {
		return fileUrl;
	}

	public void setFileUrl(String fileUrl) {
		this.fileUrl = fileUrl;
	}

	public String getContentDisposition() {
		return contentDisposition;
	}

	public void setContentDisposition(String contentDisposition) {
		this.contentDisposition = contentDisposition;
	}

	public String getPollingJwt() {
		return pollingJwt;
	}

	public void setPollingJwt(String pollingJwt) {
		this.pollingJwt = pollingJwt;
	}

	public String getPollingUrl() {
		return pollingUrl;
	}

	public void setPollingUrl(String pollingUrl) {
		this.pollingUrl = pollingUrl;
	}

	public String getCustomId() {
		return customId;
	}

	public void setCustomId(String customId) {
		this.customId = customId;
	}

	public String getUrl() {
		return url;
	}

	public void setUrl(String url) {
		this.url = url;
	}

	public Map<String, String> getFields() {
		return fields;
	}

	public void setFields(Map<String, String> fields) {
		this.fields = fields;
	}

	@Override
	public String toString() {
		return "PresignedPost [key=" + key + ", fileName=" + fileName + ", url=" + url + "]";
	}

}
