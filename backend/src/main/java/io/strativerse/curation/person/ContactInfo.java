package io.strativerse.curation.person;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Entity
@Table(name = "contact_info")
public class ContactInfo {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "person_id", nullable = false)
  private UUID personId;

  @Column(name = "updated", nullable = false)
  private LocalDate updated;

  @Column(name = "email", nullable = false, length = 255)
  private String email;

  @Column(name = "telephone", nullable = false, length = 55)
  private String telephone;

  @Column(name = "address", nullable = false, columnDefinition = "TEXT")
  private String address;

  protected ContactInfo() {}

  public ContactInfo(
      UUID personId, LocalDate updated, String email, String telephone, String address) {
    this.personId = personId;
    this.updated = updated != null ? updated : LocalDate.now();
    this.email = email != null ? email : "";
    this.telephone = telephone != null ? telephone : "";
    this.address = address != null ? address : "";
  }

  public UUID getId() {
    return id;
  }

  public UUID getPersonId() {
    return personId;
  }

  public LocalDate getUpdated() {
    return updated;
  }

  public String getEmail() {
    return email;
  }

  public String getTelephone() {
    return telephone;
  }

  public String getAddress() {
    return address;
  }

  /** Non-blank fields as {@code key: value}, joined by " // ". */
  public String summary() {
    var info = new ArrayList<String>();
    addIfPresent(info, "email", email);
    addIfPresent(info, "telephone", telephone);
    addIfPresent(info, "address", address);
    return info.isEmpty() ? "<no info>" : String.join(" // ", info);
  }

  private static void addIfPresent(List<String> info, String key, String value) {
    if (value != null && !value.isBlank()) {
      info.add(key + ": " + value);
    }
  }
}
