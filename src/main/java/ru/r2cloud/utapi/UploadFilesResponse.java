package ru.r2cloud.utapi;

import java.util.ArrayList;
import java.util.List;

public class UploadFilesResponse {

	private List<PresignedPost> data = new ArrayList<>();

	public List<PresignedPost> getData() {
		return data;
	}

	public void setData(List<PresignedPost> data) {
		this.data = data;
	}

}
