package ru.r2cloud.utapi;

public class UploadFileInfo {

	private String name;
	private long size;
	private String type;
	private String customId;

	public UploadFileInfo() {
		// do nothing
	}

	public UploadFileInfo(String name, long size, String type) {
		this.name = name;
		this.size = size;
		this.type = type;
	}

	public String getName() {
		return name;
	}

	public void setName(String name) {
		this.name = name;
	}

	public long getSize() {
		return size;
	}

	public void setSize(long size) {
		this.size = size;
	}

	/**
	 * @return mime type
	 */
	public String getType() {
		return type;
	}

	public void setType(String type) {
		this.type = type;
	}

	public String getCustomId() {
		return customId;
	}

	public void setCustomId(String customId) {
		this.customId = customId;
	}

	@Override
	public String toString() {
		return "UploadFileInfo [name=" + name + ", size=" + size + ", type=" + type + ", customId=" + customId + "]";
	}

}
