package io.trektribe.backend.account;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import org.hibernate.annotations.Immutable;

/** Projection of the account table. Rows are owned and written by the account subsystem. */
@Entity
@Immutable
@Table(name = "users")
public class UserAccount {

  @Id
  @Column(name = "id", length = 64)
  private String id;

  @Column(name = "email", length = 320)
  private String email;

  protected UserAccount() {}

  public String getEmail() {
    return email;
  }
}
