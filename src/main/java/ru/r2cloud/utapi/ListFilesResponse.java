package ru.r2cloud.utapi;

import java.util.ArrayList;
import java.util.List;

public class ListFilesResponse {

	private boolean hasMore;
	private List<FileEntry> files = new ArrayList<>();

	public boolean isHasMore() {
		return hasMore;
	}

	public void setHasMore(boolean hasMore) {
		this.hasMore = hasMore;
	}

	public List<FileEntry> getFiles() {
		return files;
	}

	public void setFiles(List<FileEntry> files) {
		this.files = files;
	}

}
