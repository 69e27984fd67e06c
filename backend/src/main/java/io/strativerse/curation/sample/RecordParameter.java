package io.strativerse.curation.sample;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.util.UUID;

/** A parameter measured on a record, with units and summary statistics of the measured values. */
@Entity
@Table(
    name = "record_parameters",
    uniqueConstraints = @UniqueConstraint(columnNames = {"record_id", "parameter_id"}))
public class RecordParameter {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "record_id", nullable = false)
  private UUID recordId;

  @Column(name = "parameter_id", nullable = false)
  private UUID parameterId;

  @Column(name = "units", nullable = false, length = 55)
  private String units;

  @Column(name = "n_values")
  private Integer nValues;

  @Column(name = "min_value")
  private Double minValue;

  @Column(name = "max_value")
  private Double maxValue;

  @Column(name = "mean_value")
  private Double meanValue;

  protected RecordParameter() {}

  public RecordParameter(UUID recordId, UUID parameterId, String units) {
    this.recordId = recordId;
    this.parameterId = parameterId;
    this.units = units != null ? units : "";
  }

  public void updateSummary(Integer nValues, Double minValue, Double maxValue, Double meanValue) {
    this.nValues = nValues;
    this.minValue = minValue;
    this.maxValue = maxValue;
    this.meanValue = meanValue;
  }

  public void updateUnits(String units) {
    this.units = units != null ? units : "";
  }

  public UUID getId() {
    return id;
  }

  public UUID getRecordId() {
    return recordId;
  }

  public UUID getParameterId() {
    return parameterId;
  }

  public String getUnits() {
    return units;
  }

  public Integer getNValues() {
    return nValues;
  }

  public Double getMinValue() {
    return minValue;
  }

  public Double getMaxValue() {
    return maxValue;
  }

  public Double getMeanValue() {
    return meanValue;
  }
}
