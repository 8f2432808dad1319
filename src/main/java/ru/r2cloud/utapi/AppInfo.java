package ru.r2cloud.utapi;

public class AppInfo {

	private String appId;
	private String defaultAcl;
	private boolean allowAclOverride;

	public String getAppId() {
		return appId;
	}

	public void setAppId(String appId) {
		this.appId = appId;
	}

	public String getDefaultAcl() {
		return defaultAcl;
	}

	public void setDefaultAcl(String defaultAcl) {
		this.defaultAcl = defaultAcl;
	}

	public boolean isAllowAclOverride() {
		return allowAclOverride;
	}

	public void setAllowAclOverride(boolean allowAclOverride) {
		this.allowAclOverride = allowAclOverride;
	}

}
