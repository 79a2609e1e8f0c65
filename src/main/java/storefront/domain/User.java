package storefront.domain;

/**
 * A registered account. {@code passwordHash} holds the bcrypt hash, never the plaintext,
 * and must not leave the service boundary.
 */
public class User {
  private Long id;
  private String username;
  private String email;
  private String passwordHash;
  private boolean admin;

  public User() {
  }

  public User(Long id, String username, String email, String passwordHash, boolean admin) {
    this.id = id;
    this.username = username;
    this.email = email;
    this.passwordHash = passwordHash;
    this.admin = admin;
  }

  public Long getId() {
    return id;
  }

  public String getUsername() {
    return username;
  }

  public String getEmail() {
    return email;
  }

  public String getPasswordHash() {
    return passwordHash;
  }

  public boolean isAdmin() {
    return admin;
  }

  public void setId(Long id) {
    this.id = id;
  }

  public void setUsername(String username) {
    this.username = username;
  }

  public void setEmail(String email) {
    this.email = email;
  }

  public void setPasswordHash(String passwordHash) {
    this.passwordHash = passwordHash;
  }

  public void setAdmin(boolean admin) {
    this.admin = admin;
  }
}
