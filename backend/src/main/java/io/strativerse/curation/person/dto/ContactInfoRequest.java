package io.strativerse.curation.person.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Size;
import java.time.LocalDate;

public record ContactInfoRequest(
    LocalDate updated,
    @Email @Size(max = 255) String email,
    @Size(max = 55) String telephone,
    String address) {}
