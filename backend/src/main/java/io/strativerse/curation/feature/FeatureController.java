package io.strativerse.curation.feature;

import io.strativerse.curation.feature.dto.FeatureRequest;
import io.strativerse.curation.feature.dto.FeatureResponse;
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
@RequestMapping("/api/features")
public class FeatureController {

  private final FeatureService featureService;

  public FeatureController(FeatureService featureService) {
    this.featureService = featureService;
  }

  @GetMapping("/{id}")
  public ResponseEntity<FeatureResponse> get(@PathVariable UUID id) {
    return ResponseEntity.ok(FeatureResponse.from(featureService.get(id)));
  }

  @GetMapping("/{id}/children")
  public ResponseEntity<List<FeatureResponse>> children(@PathVariable UUID id) {
    return ResponseEntity.ok(
        featureService.children(id).stream().map(FeatureResponse::from).toList());
  }

  @GetMapping("/{id}/ancestors")
  public ResponseEntity<List<FeatureResponse>> ancestors(@PathVariable UUID id) {
    return ResponseEntity.ok(
        featureService.ancestors(id).stream().map(FeatureResponse::from).toList());
  }

  @PostMapping
  public ResponseEntity<FeatureResponse> create(@Valid @RequestBody FeatureRequest request) {
    var feature = featureService.create(request);
    return ResponseEntity.created(URI.create("/api/features/" + feature.getId()))
        .body(FeatureResponse.from(feature));
  }

  @PutMapping("/{id}")
  public ResponseEntity<FeatureResponse> update(
      @PathVariable UUID id, @Valid @RequestBody FeatureRequest request) {
    return ResponseEntity.ok(FeatureResponse.from(featureService.update(id, request)));
  }

  @DeleteMapping("/{id}")
  public ResponseEntity<Void> delete(@PathVariable UUID id) {
    featureService.delete(id);
    return ResponseEntity.noContent().build();
  }
}
