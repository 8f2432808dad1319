package ru.r2cloud.utapi;

import java.util.List;

import com.eclipsesource.json.JsonValue;

public class UploadFilesRequest {

	private List<UploadFileInfo> files;
	private Acl acl;
	private JsonValue metadata;
	private String contentDisposition;

	public List<UploadFileInfo> getFiles() {
		return files;
	}

	public void setFiles(List<UploadFileInfo> files) {
		this.files = files;
	}

	public Acl getAcl() {
		return acl;
	}

	public void setAcl(Acl acl) {
		this.acl = acl;
	}

	/**
	 * Arbitrary json attached to the upload. Not sent when null
	 */
	public JsonValue getMetadata() {
		return metadata;
	}

	public void setMetadata(JsonValue metadata) {
		this.metadata = metadata;
	}

	public String getContentDisposition() {
		return contentDisposition;
	}

	public void setContentDisposition(String contentDisposition) {
		this.contentDisposition = contentDisposition;
	}

	@Override
	public String toString() {
		return "UploadFilesRequest [files=" + files + ", acl=" + acl + ", contentDisposition=" + contentDisposition + "]";
	}

}
