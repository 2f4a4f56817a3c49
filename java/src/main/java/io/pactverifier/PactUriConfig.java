package io.pactverifier;

/**
 * Optional basic-auth credentials used when the pact is fetched from a remote location.
 *
 * @param username basic-auth user; blank means no authentication.
 * @param password basic-auth password.
 */
public record PactUriConfig(String username, String password) {

    public static final PactUriConfig NONE = new PactUriConfig(null, null);

    public boolean hasUsername() {
        return username != null && !username.isBlank();
    }

    @Override
    public String toString() {
        return "PactUriConfig[username=" + username + ", password=" + (password == null ? "null" : "****") + "]";
    }
}
