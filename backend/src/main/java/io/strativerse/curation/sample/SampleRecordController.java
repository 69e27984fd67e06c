package io.strativerse.curation.sample;

import io.strativerse.curation.sample.dto.RecordAuthorshipRequest;
import io.strativerse.curation.sample.dto.RecordParameterRequest;
import io.strativerse.curation.sample.dto.RecordReferenceRequest;
import io.strativerse.curation.sample.dto.SampleRecordRequest;
import io.strativerse.curation.sample.dto.SampleRecordResponse;
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
@RequestMapping("/api/records")
public class SampleRecordController {

  private final SampleRecordService recordService;

  public SampleRecordController(SampleRecordService recordService) {
    this.recordService = recordService;
  }

  @GetMapping("/{id}")
  public ResponseEntity<SampleRecordResponse> get(@PathVariable UUID id) {
    return ResponseEntity.ok(toResponse(recordService.get(id)));
  }

  @PostMapping
  public ResponseEntity<SampleRecordResponse> create(
      @Valid @RequestBody SampleRecordRequest request) {
    var record = recordService.create(request);
    return ResponseEntity.created(URI.create("/api/records/" + record.getId()))
        .body(toResponse(record));
  }

  @PutMapping("/{id}")
  public ResponseEntity<SampleRecordResponse> update(
      @PathVariable UUID id, @Valid @RequestBody SampleRecordRequest request) {
    return ResponseEntity.ok(toResponse(recordService.update(id, request)));
  }

  @DeleteMapping("/{id}")
  public ResponseEntity<Void> delete(@PathVariable UUID id) {
    recordService.delete(id);
    return ResponseEntity.noContent().build();
  }

  @PutMapping("/{id}/authorships")
  public ResponseEntity<SampleRecordResponse> replaceAuthorships(
      @PathVariable UUID id, @Valid @RequestBody List<RecordAuthorshipRequest> request) {
    recordService.replaceAuthorships(id, request);
    return ResponseEntity.ok(toResponse(recordService.get(id)));
  }

  @PostMapping("/{id}/references")
  public ResponseEntity<SampleRecordResponse> addReference(
      @PathVariable UUID id, @Valid @RequestBody RecordReferenceRequest request) {
    recordService.addReference(id, request.publicationId(), request.type());
    return ResponseEntity.ok(toResponse(recordService.get(id)));
  }

  @DeleteMapping("/{id}/references/{referenceId}")
  public ResponseEntity<Void> removeReference(
      @PathVariable UUID id, @PathVariable UUID referenceId) {
    recordService.removeReference(id, referenceId);
    return ResponseEntity.noContent().build();
  }

  @PutMapping("/{id}/parameters")
  public ResponseEntity<Void> setParameter(
      @PathVariable UUID id, @Valid @RequestBody RecordParameterRequest request) {
    recordService.setParameter(id, request);
    return ResponseEntity.noContent().build();
  }

  private SampleRecordResponse toResponse(SampleRecord record) {
    return SampleRecordResponse.from(
        record,
        recordService.authorships(record.getId()),
        recordService.references(record.getId()));
  }
}
