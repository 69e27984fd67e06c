package io.strativerse.curation.geometry;

import io.strativerse.curation.geometry.dto.IdentifyGeometryRequest;
import io.strativerse.curation.geometry.dto.IdentifyGeometryResponse;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/geometry")
public class GeometryController {

  @PostMapping("/identify")
  public ResponseEntity<IdentifyGeometryResponse> identify(
      @RequestBody IdentifyGeometryRequest request) {
    var type = Wkt.identifyGeometry(request.wkt());
    return ResponseEntity.ok(
        new IdentifyGeometryResponse(
            type.isPresent(), type.orElse(null), Wkt.bounds(request.wkt())));
  }
}
