package io.strativerse.curation.parameter;

import io.strativerse.curation.parameter.dto.ParameterRequest;
import io.strativerse.curation.parameter.dto.ParameterResponse;
import jakarta.validation.Valid;
import java.net.URI;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/parameters")
public class ParameterController {

  private final ParameterService parameterService;

  public ParameterController(ParameterService parameterService) {
    this.parameterService = parameterService;
  }

  @GetMapping
  public ResponseEntity<List<ParameterResponse>> list() {
    return ResponseEntity.ok(
        parameterService.listAll().stream().map(ParameterResponse::from).toList());
  }

  @GetMapping("/{slug}")
  public ResponseEntity<ParameterResponse> get(@PathVariable String slug) {
    return ResponseEntity.ok(ParameterResponse.from(parameterService.getBySlug(slug)));
  }

  @PostMapping
  public ResponseEntity<ParameterResponse> create(@Valid @RequestBody ParameterRequest request) {
    var parameter = parameterService.create(request);
    return ResponseEntity.created(URI.create("/api/parameters/" + parameter.getSlug()))
        .body(ParameterResponse.from(parameter));
  }

  @PutMapping("/{id}")
  public ResponseEntity<ParameterResponse> update(
      @PathVariable UUID id, @Valid @RequestBody ParameterRequest request) {
    return ResponseEntity.ok(ParameterResponse.from(parameterService.update(id, request)));
  }

  @DeleteMapping("/{id}")
  public ResponseEntity<Void> delete(@PathVariable UUID id) {
    parameterService.delete(id);
    return ResponseEntity.noContent().build();
  }
}
