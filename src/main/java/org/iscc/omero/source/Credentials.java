package org.iscc.omero.source;

/**
 * Repository login. The password never appears in {@link #toString()}.
 */
public record Credentials(String username, String password) {

    public static Credentials anonymous() {
        return new Credentials(null, null);
    }

    public boolean isAnonymous() {
        return username == null || username.isBlank();
    }

    @Override
    public String toString() {
        return "Credentials[username=" + username + ", password=" + (password == null ? "<none>" : "****") + "]";
    }
}
