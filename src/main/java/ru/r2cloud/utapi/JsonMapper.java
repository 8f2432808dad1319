package ru.r2cloud.utapi;

import java.util.ArrayList;
import java.util.List;

import com.eclipsesource.json.Json;
import com.eclipsesource.json.JsonArray;
import com.eclipsesource.json.JsonObject;
import com.eclipsesource.json.JsonObject.Member;
import com.eclipsesource.json.JsonValue;

/**
 * Missing or null fields are read as zero values. Fields of unexpected type
 * throw {@link UnsupportedOperationException}.
 */
final class JsonMapper {

	static JsonObject toJson(List<String> fileKeys) {
		JsonArray keys = new JsonArray();
		for (String cur : fileKeys) {
			keys.add(cur);
		}
		JsonObject result = new JsonObject();
		result.add("fileKeys", keys);
		return result;
	}

	static JsonObject toJson(ListRequest req) {
		JsonObject result = new JsonObject();
		result.add("limit", req.getLimit());
		result.add("offset", req.getOffset());
		return result;
	}

	static JsonObject toJsonUpdates(List<RenameFileUpdate> updates) {
		JsonArray array = new JsonArray();
		for (RenameFileUpdate cur : updates) {
			JsonObject obj = new JsonObject();
			obj.add("fileKey", cur.getFileKey());
			obj.add("newName", cur.getNewName());
			array.add(obj);
		}
		JsonObject result = new JsonObject();
		result.add("updates", array);
		return result;
	}

	static JsonObject toJson(String fileKey, int expiresIn) {
		JsonObject result = new JsonObject();
		result.add("fileKey", fileKey);
		if (expiresIn != 0) {
			result.add("expiresIn", expiresIn);
		}
		return result;
	}

	static JsonObject toJson(UploadFilesRequest req) {
		JsonArray files = new JsonArray();
		for (UploadFileInfo cur : req.getFiles()) {
			JsonObject obj = new JsonObject();
			obj.add("name", cur.getName());
			obj.add("size", cur.getSize());
			obj.add("type", cur.getType());
			if (cur.getCustomId() != null) {
				obj.add("customId", cur.getCustomId());
			}
			files.add(obj);
		}
		JsonObject result = new JsonObject();
		result.add("files", files);
		if (req.getAcl() != null) {
			result.add("acl", req.getAcl().getValue());
		} else {
			result.add("acl", "");
		}
		if (req.getMetadata() != null) {
			result.add("metadata", req.getMetadata());
		}
		if (req.getContentDisposition() != null && !req.getContentDisposition().isEmpty()) {
			result.add("contentDisposition", req.getContentDisposition());
		}
		return result;
	}

	static DeleteFilesResponse readDeleteFiles(JsonObject obj) {
		DeleteFilesResponse result = new DeleteFilesResponse();
		result.setSuccess(getBoolean(obj, "success"));
		result.setDeletedCount(getInt(obj, "deletedCount"));
		return result;
	}

	static ListFilesResponse readListFiles(JsonObject obj) {
		ListFilesResponse result = new ListFilesResponse();
		result.setHasMore(getBoolean(obj, "hasMore"));
		List<FileEntry> files = new ArrayList<>();
		for (JsonValue cur : getArray(obj, "files")) {
			files.add(readFileEntry(cur.asObject()));
		}
		result.setFiles(files);
		return result;
	}

	private static FileEntry readFileEntry(JsonObject obj) {
		FileEntry result = new FileEntry();
		result.setId(getString(obj, "id"));
		result.setCustomId(getString(obj, "customId"));
		result.setKey(getString(obj, "key"));
		result.setName(getString(obj, "name"));
		result.setStatus(getString(obj, "status"));
		result.setSize(getLong(obj, "size"));
		result.setUploadedAt(getLong(obj, "uploadedAt"));
		return result;
	}

	static RenameFilesResponse readRenameFiles(JsonObject obj) {
		RenameFilesResponse result = new RenameFilesResponse();
		result.setSuccess(getBoolean(obj, "success"));
		result.setRenamedCount(getInt(obj, "renamedCount"));
		return result;
	}

	static UsageInfo readUsageInfo(JsonObject obj) {
		UsageInfo result = new UsageInfo();
		result.setTotalBytes(getLong(obj, "totalBytes"));
		result.setAppTotalBytes(getLong(obj, "appTotalBytes"));
		result.setFilesUploaded(getInt(obj, "filesUploaded"));
		result.setLimitBytes(getLong(obj, "limitBytes"));
		return result;
	}

	static FileAccess readFileAccess(JsonObject obj) {
		FileAccess result = new FileAccess();
		result.setUfsUrl(getString(obj, "ufsUrl"));
		result.setUrl(getString(obj, "url"));
		return result;
	}

	static AppInfo readAppInfo(JsonObject obj) {
		AppInfo result = new AppInfo();
		result.setAppId(getString(obj, "appId"));
		result.setDefaultAcl(getString(obj, "defaultACL"));
		result.setAllowAclOverride(getBoolean(obj, "allowACLOverride"));
		return result;
	}

	static UploadFilesResponse readUploadFiles(JsonObject obj) {
		UploadFilesResponse result = new UploadFilesResponse();
		List<PresignedPost> data = new ArrayList<>();
		for (JsonValue cur : getArray(obj, "data")) {
			data.add(readPresignedPost(cur.asObject()));
		}
		result.setData(data);
		return result;
	}

	static PresignedPost readPresignedPost(JsonObject obj) {
		PresignedPost result = new PresignedPost();
		result.setKey(getString(obj, "key"));
		result.setFileName(getString(obj, "fileName"));
		result.setFileType(getString(obj, "fileType"));
		result.setFileUrl(getString(obj, "fileUrl"));
		result.setContentDisposition(getString(obj, "contentDisposition"));
		result.setPollingJwt(getString(obj, "pollingJwt"));
		result.setPollingUrl(getString(obj, "pollingUrl"));
		result.setCustomId(getString(obj, "customId"));
		result.setUrl(getString(obj, "url"));
		JsonValue fields = obj.get("fields");
		if (fields != null && !fields.isNull()) {
			for (Member cur : fields.asObject()) {
				if (cur.getValue().isNull()) {
					continue;
				}
				result.getFields().put(cur.getName(), cur.getValue().asString());
			}
		}
		return result;
	}

	private static String getString(JsonObject obj, String name) {
		JsonValue value = obj.get(name);
		if (value == null || value.isNull()) {
			return null;
		}
		return value.asString();
	}

	private static long getLong(JsonObject obj, String name) {
		JsonValue value = obj.get(name);
		if (value == null || value.isNull()) {
			return 0;
		}
		return value.asLong();
	}

	private static int getInt(JsonObject obj, String name) {
		JsonValue value = obj.get(name);
		if (value == null || value.isNull()) {
			return 0;
		}
		return value.asInt();
	}

	private static boolean getBoolean(JsonObject obj, String name) {
		JsonValue value = obj.get(name);
		if (value == null || value.isNull()) {
			return false;
		}
		return value.asBoolean();
	}

	private static JsonArray getArray(JsonObject obj, String name) {
		JsonValue value = obj.get(name);
		if (value == null || value.isNull()) {
			return Json.array();
		}
		return value.asArray();
	}

	private JsonMapper() {
		// do nothing
	}
}
