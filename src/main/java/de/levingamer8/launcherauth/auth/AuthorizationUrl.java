package de.levingamer8.launcherauth.auth;

public record AuthorizationUrl(String url, String state) {

    public boolean matches(String returnedState) {
        return state.equals(returnedState);
    }
}
