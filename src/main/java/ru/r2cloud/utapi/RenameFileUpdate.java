package ru.r2cloud.utapi;

public class RenameFileUpdate {

	private String fileKey;
	private String newName;

	public RenameFileUpdate() {
		// do nothing
	}

	public RenameFileUpdate(String fileKey, String newName) {
		this.fileKey = fileKey;
		this.newName = newName;
	}

	public String getFileKey() {
		return fileKey;
	}

	public void setFileKey(String fileKey) {
		this.fileKey = fileKey;
	}

	public String getNewName() {
		return newName;
	}

	public void setNewName(String newName) {
		this.newName = newName;
	}

	@Override
	public String toString() {
		return "RenameFileUpdate [fileKey=" + fileKey + ", newName=" + newName + "]";
	}

}
