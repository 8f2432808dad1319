package ru.r2cloud.utapi;

import java.io.File;
import java.util.HashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.github.cdimascio.dotenv.Dotenv;
import io.github.cdimascio.dotenv.DotenvEntry;
import io.github.cdimascio.dotenv.DotenvException;

public class UtApiConfig {

	private static final Logger LOG = LoggerFactory.getLogger(UtApiConfig.class);

	public static final String SECRET_VARIABLE = "UPLOADTHING_SECRET";

	private String host = UploadThingClient.DEFAULT_HOST;
	private String apiKey;
	private String version = UploadThingClient.DEFAULT_VERSION;

	public static UtApiConfig load() throws UtApiException {
		return load(new File(".env"), System.getenv());
	}

	/**
	 * Variables from env take precedence over the ones from dotEnv file. Missing
	 * dotEnv file is not an error
	 */
	public static UtApiConfig load(File dotEnv, Map<String, String> env) throws UtApiException {
		Map<String, String> variables = new HashMap<>();
		if (dotEnv != null && dotEnv.isFile()) {
			variables.putAll(readDotEnv(dotEnv));
		} else {
			LOG.info("{} not found. using environment only", dotEnv);
		}
		variables.putAll(env);
		String secret = variables.get(SECRET_VARIABLE);
		if (secret == null || secret.isEmpty()) {
			throw new UtApiException(UtApiException.INTERNAL_SERVER_ERROR, SECRET_VARIABLE + " is not set");
		}
		UtApiConfig result = new UtApiConfig();
		result.setApiKey(secret);
		return result;
	}

	static Map<String, String> readDotEnv(File file) throws UtApiException {
		File absolute = file.getAbsoluteFile();
		Dotenv dotenv;
		try {
			dotenv = Dotenv.configure().directory(absolute.getParent()).filename(absolute.getName()).ignoreIfMissing().load();
		} catch (DotenvException e) {
			throw new UtApiException(UtApiException.INTERNAL_SERVER_ERROR, "unable to read: " + absolute.getAbsolutePath(), e);
		}
		Map<String, String> result = new HashMap<>();
		for (DotenvEntry cur : dotenv.entries(Dotenv.Filter.DECLARED_IN_ENV_FILE)) {
			String value = cur.getValue();
			result.put(cur.getKey(), value == null ? "" : value.trim());
		}
		return result;
	}

	public String getHost() {
		return host;
	}

	public void setHost(String host) {
		this.host = host;
	}

	public String getApiKey() {
		return apiKey;
	}

	public void setApiKey(String apiKey) {
		this.apiKey = apiKey;
	}

	public String getVersion() {
		return version;
	}

	public void setVersion(String version) {
		this.version = version;
	}

	@Override
	public String toString() {
		// no api key
		return "UtApiConfig [host=" + host + ", version=" + version + "]";
	}

}
