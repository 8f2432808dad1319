package ru.r2cloud.utapi;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Properties;

import org.apache.http.HttpEntity;
import org.apache.http.client.config.RequestConfig;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpPost;
import org.apache.http.entity.StringEntity;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.HttpClientBuilder;
import org.apache.http.util.EntityUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.eclipsesource.json.Json;
import com.eclipsesource.json.JsonObject;
import com.eclipsesource.json.JsonValue;
import com.eclipsesource.json.ParseException;

public class UploadThingClient implements UtApi {

	private static final Logger LOG = LoggerFactory.getLogger(UploadThingClient.class);

	public static final String DEFAULT_HOST = "https://api.uploadthing.com";
	public static final String DEFAULT_VERSION = "7.6.0";
	public static final String DEFAULT_BE_ADAPTER = "ru.r2cloud/utapi";

	private static final String API_KEY_HEADER = "x-uploadthing-api-key";
	private static final String VERSION_HEADER = "x-uploadthing-version";
	private static final String FE_PACKAGE_HEADER = "x-uploadthing-fe-package";
	private static final String BE_ADAPTER_HEADER = "x-uploadthing-be-adapter";

	private static String userAgent;
	private String host = DEFAULT_HOST;
	private String apiKey;
	private String version = DEFAULT_VERSION;
	private String fePackage;
	private String beAdapter = DEFAULT_BE_ADAPTER;
	private int timeout = 10_000;

	private CloseableHttpClient httpclient;

	static {
		String version = readVersion();
		if (version == null) {
			version = "1.0";
		}
		userAgent = "utapi/" + version + " (dernasherbrezon)";
	}

	/**
	 * Reads UPLOADTHING_SECRET from the environment or .env and returns started
	 * client
	 */
	public static UploadThingClient fromEnvironment() throws UtApiException {
		return fromEnvironment(new File(".env"), System.getenv());
	}

	static UploadThingClient fromEnvironment(File dotEnv, Map<String, String> env) throws UtApiException {
		UtApiConfig config = UtApiConfig.load(dotEnv, env);
		UploadThingClient result = new UploadThingClient();
		result.setConfig(config);
		result.start();
		return result;
	}

	public void start() {
		if (apiKey == null || apiKey.isEmpty()) {
			throw new IllegalStateException("api key is not set");
		}
		httpclient = createClient(timeout);
	}

	public void stop() throws IOException {
		if (httpclient != null) {
			httpclient.close();
		}
	}

	@Override
	public DeleteFilesResponse deleteFiles(List<String> fileKeys) throws UtApiException {
		if (fileKeys == null) {
			throw new IllegalArgumentException("file keys are null");
		}
		if (LOG.isTraceEnabled()) {
			LOG.trace("deleting: {}", fileKeys);
		}
		return post("/v6/deleteFiles", JsonMapper.toJson(fileKeys), JsonMapper::readDeleteFiles);
	}

	@Override
	public ListFilesResponse listFiles(ListRequest req) throws UtApiException {
		if (req == null) {
			req = new ListRequest();
		}
		if (LOG.isTraceEnabled()) {
			LOG.trace("listing: {}", req);
		}
		return post("/v6/listFiles", JsonMapper.toJson(req), JsonMapper::readListFiles);
	}

	@Override
	public RenameFilesResponse renameFiles(List<RenameFileUpdate> updates) throws UtApiException {
		if (updates == null) {
			throw new IllegalArgumentException("updates are null");
		}
		if (LOG.isTraceEnabled()) {
			LOG.trace("renaming: {}", updates);
		}
		return post("/v6/renameFiles", JsonMapper.toJsonUpdates(updates), JsonMapper::readRenameFiles);
	}

	@Override
	public UsageInfo getUsageInfo() throws UtApiException {
		return post("/v6/getUsageInfo", new JsonObject(), JsonMapper::readUsageInfo);
	}

	@Override
	public FileAccess requestFileAccess(String fileKey, int expiresIn) throws UtApiException {
		if (LOG.isTraceEnabled()) {
			LOG.trace("requesting access: {} expires in: {}", fileKey, expiresIn);
		}
		return post("/v6/requestFileAccess", JsonMapper.toJson(fileKey, expiresIn), JsonMapper::readFileAccess);
	}

	@Override
	public String getPresignedUrl(String fileKey, int expiresIn) throws UtApiException {
		return requestFileAccess(fileKey, expiresIn).getUfsUrl();
	}

	@Override
	public AppInfo getAppInfo() throws UtApiException {
		return post("/v7/getAppInfo", new JsonObject(), JsonMapper::readAppInfo);
	}

	@Override
	public UploadFilesResponse getPresignedUploadUrl(List<UploadFileInfo> files, Acl acl) throws UtApiException {
		UploadFilesRequest req = new UploadFilesRequest();
		req.setFiles(files);
		req.setAcl(acl);
		return getPresignedUploadUrl(req);
	}

	@Override
	public UploadFilesResponse getPresignedUploadUrl(UploadFilesRequest req) throws UtApiException {
		if (req == null || req.getFiles() == null) {
			throw new IllegalArgumentException("files are null");
		}
		if (LOG.isTraceEnabled()) {
			LOG.trace("requesting upload: {}", req);
		}
		return post("/v6/uploadFiles", JsonMapper.toJson(req), JsonMapper::readUploadFiles);
	}

	private <T> T post(String path, JsonObject payload, ResponseConverter<T> converter) throws UtApiException {
		if (httpclient == null) {
			throw new IllegalStateException("client is not started");
		}
		HttpPost method = new HttpPost(host + path);
		method.setHeader("Content-Type", "application/json");
		method.setHeader(API_KEY_HEADER, apiKey);
		method.setHeader(VERSION_HEADER, version);
		if (fePackage != null && !fePackage.isEmpty()) {
			method.setHeader(FE_PACKAGE_HEADER, fePackage);
		}
		if (beAdapter != null && !beAdapter.isEmpty()) {
			method.setHeader(BE_ADAPTER_HEADER, beAdapter);
		}
		method.setEntity(new StringEntity(payload.toString(), StandardCharsets.UTF_8));
		CloseableHttpResponse response = null;
		try {
			response = httpclient.execute(method);
			int statusCode = response.getStatusLine().getStatusCode();
			String body = readBody(response.getEntity());
			if (statusCode < 200 || statusCode >= 300) {
				LOG.info("invalid response for {}: {}", path, statusCode);
				throw new UtApiException(statusCode, "UploadThing: error " + statusCode + ": " + body);
			}
			if (LOG.isDebugEnabled()) {
				LOG.debug("response: {}", body);
			}
			return parse(body, converter);
		} catch (IOException e) {
			throw new UtApiException(UtApiException.INTERNAL_SERVER_ERROR, "unable to process: " + path, e);
		} finally {
			if (response != null) {
				EntityUtils.consumeQuietly(response.getEntity());
			}
		}
	}

	private static <T> T parse(String body, ResponseConverter<T> converter) throws UtApiException {
		JsonValue parsed;
		try {
			parsed = Json.parse(body);
		} catch (ParseException e) {
			throw new UtApiException(UtApiException.INTERNAL_SERVER_ERROR, "unable to parse response", e);
		}
		if (!parsed.isObject()) {
			throw new UtApiException(UtApiException.INTERNAL_SERVER_ERROR, "unable to parse response: not an object");
		}
		try {
			return converter.convert(parsed.asObject());
		} catch (UnsupportedOperationException | NumberFormatException e) {
			throw new UtApiException(UtApiException.INTERNAL_SERVER_ERROR, "unable to parse response", e);
		}
	}

	static String readBody(HttpEntity entity) throws IOException {
		if (entity == null) {
			return "";
		}
		return EntityUtils.toString(entity, StandardCharsets.UTF_8);
	}

	static CloseableHttpClient createClient(int timeout) {
		RequestConfig config = RequestConfig.custom().setConnectTimeout(timeout).setConnectionRequestTimeout(timeout).setSocketTimeout(timeout).build();
		return HttpClientBuilder.create().setUserAgent(userAgent).setDefaultRequestConfig(config).build();
	}

	public void setConfig(UtApiConfig config) {
		this.host = config.getHost();
		this.apiKey = config.getApiKey();
		this.version = config.getVersion();
	}

	public void setHost(String host) {
		this.host = host;
	}

	public void setApiKey(String apiKey) {
		this.apiKey = apiKey;
	}

	public void setVersion(String version) {
		this.version = version;
	}

	public void setFePackage(String fePackage) {
		this.fePackage = fePackage;
	}

	public void setBeAdapter(String beAdapter) {
		this.beAdapter = beAdapter;
	}

	public void setTimeout(int timeout) {
		this.timeout = timeout;
	}

	private static String readVersion() {
		try (InputStream is = UploadThingClient.class.getClassLoader().getResourceAsStream("META-INF/maven/ru.r2cloud/utapi/pom.properties")) {
			if (is != null) {
				Properties p = new Properties();
				p.load(is);
				return p.getProperty("version", null);
			}
			return null;
		} catch (IOException e) {
			return null;
		}
	}
}
