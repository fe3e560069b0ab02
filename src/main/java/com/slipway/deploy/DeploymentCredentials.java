package com.slipway.deploy;

/**
 * Deployment API credentials for one trigger call. {@link #toString} never shows the password.
 */
public record DeploymentCredentials(String username, String password) {

    public static DeploymentCredentials none() {
        return new DeploymentCredentials(null, null);
    }

    public boolean isPresent() {
        return username != null && !username.isBlank() && password != null && !password.isBlank();
    }

    @Override
    public String toString() {
        return "DeploymentCredentials[username=" + username + ", password=****]";
    }
}
