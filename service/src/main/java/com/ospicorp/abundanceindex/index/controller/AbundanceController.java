package com.ospicorp.abundanceindex.index.controller;

import com.ospicorp.abundanceindex.common.InputContractException;
import com.ospicorp.abundanceindex.config.AbundanceProperties;
import com.ospicorp.abundanceindex.config.CsvHttpMessageConverter;
import com.ospicorp.abundanceindex.flightcurve.model.CurveEstimationOptions;
import com.ospicorp.abundanceindex.flightcurve.model.CurveEstimationResult;
import com.ospicorp.abundanceindex.flightcurve.model.FlightCurveResponse;
import com.ospicorp.abundanceindex.flightcurve.model.FlightCurveTable;
import com.ospicorp.abundanceindex.flightcurve.service.CurveEstimator;
import com.ospicorp.abundanceindex.imputation.model.ImputationOptions;
import com.ospicorp.abundanceindex.index.model.IndexResponse;
import com.ospicorp.abundanceindex.index.model.PipelineResult;
import com.ospicorp.abundanceindex.index.service.AbundancePipeline;
import com.ospicorp.abundanceindex.season.model.SeasonTable;
import com.ospicorp.abundanceindex.season.service.SeasonTableParser;
import com.ospicorp.abundanceindex.stats.ModelFamily;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.MimeTypeUtils;
import org.springframework.util.StringUtils;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1")
@Validated
@Tag(name = "Abundance")
public class AbundanceController {
  private static final MediaType CSV_MEDIA_TYPE = CsvHttpMessageConverter.TEXT_CSV;

  private final CurveEstimator curveEstimator;
  private final AbundancePipeline pipeline;
  private final AbundanceProperties properties;

  public AbundanceController(CurveEstimator curveEstimator, AbundancePipeline pipeline,
      AbundanceProperties properties) {
    this.curveEstimator = curveEstimator;
    this.pipeline = pipeline;
    this.properties = properties;
  }

  @PostMapping(path = "/flight-curves", consumes = {MediaType.APPLICATION_JSON_VALUE, "text/csv"})
  @Operation(summary = "Estimate flight curves",
      description = "Fit one regional flight curve per year from a season count table.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Flight curves",
          content = {
              @Content(mediaType = "application/json",
                  schema = @Schema(implementation = FlightCurveResponse.class)),
              @Content(mediaType = "text/csv")
          }),
      @ApiResponse(responseCode = "400", description = "Season table or options rejected")
  })
  public ResponseEntity<?> flightCurves(@RequestBody List<Map<String, Object>> rows,
      @RequestParam(required = false) @Parameter(description = "poisson, nb or quasipoisson") String family,
      @RequestParam(required = false) @Parameter(description = "Years to estimate") List<Integer> years,
      @RequestParam(required = false) @Parameter(description = "Seed of the site subsampling") Long seed,
      @RequestParam(name = "format", required = false) String format,
      @RequestHeader(value = HttpHeaders.ACCEPT, required = false) String accept) {
    MediaType contentType = selectMediaType(format, accept);
    SeasonTable table = SeasonTableParser.parse(rows);
    CurveEstimationOptions options = curveOptions(family, years, seed);
    CurveEstimationResult result = curveEstimator.estimate(table, options);

    if (contentType.isCompatibleWith(CSV_MEDIA_TYPE)) {
      return ResponseEntity.ok().contentType(CSV_MEDIA_TYPE).body(result.curves().points());
    }
    FlightCurveTable curves = result.curves();
    List<Integer> complete = curves.years().stream().filter(curves::isComplete).toList();
    return ResponseEntity.ok().contentType(MediaType.APPLICATION_JSON).body(
        new FlightCurveResponse(new ArrayList<>(curves.species()), new ArrayList<>(curves.years()),
            complete, curves.points(), result.diagnostics()));
  }

  @PostMapping(path = "/indices", consumes = {MediaType.APPLICATION_JSON_VALUE, "text/csv"})
  @Operation(summary = "Compute abundance indices",
      description = "Estimate flight curves, impute missing counts and aggregate one index per site and year.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Abundance indices",
          content = {
              @Content(mediaType = "application/json",
                  schema = @Schema(implementation = IndexResponse.class)),
              @Content(mediaType = "text/csv")
          }),
      @ApiResponse(responseCode = "400", description = "Season table or options rejected")
  })
  public ResponseEntity<?> indices(@RequestBody List<Map<String, Object>> rows,
      @RequestParam(name = "by_week", required = false) Boolean byWeek,
      @RequestParam(name = "week_day", required = false) @Min(1) @Max(7) Integer weekDay,
      @RequestParam(required = false) @Parameter(description = "Flight curve model family") String family,
      @RequestParam(required = false) List<Integer> years,
      @RequestParam(required = false) Long seed,
      @RequestParam(name = "nearest_phenology", required = false) Boolean nearestPhenology,
      @RequestParam(name = "format", required = false) String format,
      @RequestHeader(value = HttpHeaders.ACCEPT, required = false) String accept) {
    MediaType contentType = selectMediaType(format, accept);
    SeasonTable table = SeasonTableParser.parse(rows);
    ImputationOptions imputationOptions = properties.imputation().toOptions()
        .withYears(years == null ? null : new HashSet<>(years));
    if (nearestPhenology != null) {
      imputationOptions = imputationOptions.withNearestPhenology(nearestPhenology);
    }
    boolean weekly = byWeek != null ? byWeek : properties.index().byWeek();
    int day = weekDay != null ? weekDay : properties.index().weekDay();

    PipelineResult result = pipeline.run(table, curveOptions(family, years, seed),
        imputationOptions, weekly, day);

    if (contentType.isCompatibleWith(CSV_MEDIA_TYPE)) {
      return ResponseEntity.ok().contentType(CSV_MEDIA_TYPE).body(result.indices());
    }
    return ResponseEntity.ok().contentType(MediaType.APPLICATION_JSON).body(
        new IndexResponse(new ArrayList<>(table.species()), weekly, result.indices().size(),
            result.indices(), result.diagnostics()));
  }

  private CurveEstimationOptions curveOptions(String family, List<Integer> years, Long seed) {
    CurveEstimationOptions.Builder builder = properties.flightCurve().toOptions().toBuilder();
    if (StringUtils.hasText(family)) {
      builder.family(parseFamily(family));
    }
    if (years != null) {
      builder.years(new HashSet<>(years));
    }
    if (seed != null) {
      builder.seed(seed);
    }
    return builder.build();
  }

  private static ModelFamily parseFamily(String value) {
    try {
      return ModelFamily.fromCode(value);
    } catch (IllegalArgumentException ex) {
      throw InputContractException.of(ex.getMessage(), InputContractException.UNSUPPORTED_FAMILY);
    }
  }

  private static MediaType selectMediaType(String format, String accept) {
    if (StringUtils.hasText(format)) {
      if ("csv".equalsIgnoreCase(format)) {
        return CSV_MEDIA_TYPE;
      }
      if ("json".equalsIgnoreCase(format)) {
        return MediaType.APPLICATION_JSON;
      }
      throw InputContractException.of("Invalid format value. Supported values: json,csv.",
          InputContractException.INVALID_OPTION);
    }
    if (!StringUtils.hasText(accept)) {
      return MediaType.APPLICATION_JSON;
    }
    List<MediaType> mediaTypes = MediaType.parseMediaTypes(accept);
    mediaTypes.sort(Comparator.comparingDouble(MediaType::getQualityValue).reversed());
    MimeTypeUtils.sortBySpecificity(mediaTypes);
    for (MediaType mediaType : mediaTypes) {
      if (mediaType.isCompatibleWith(MediaType.APPLICATION_JSON)) {
        return MediaType.APPLICATION_JSON;
      }
      if (mediaType.isCompatibleWith(CSV_MEDIA_TYPE)) {
        return CSV_MEDIA_TYPE;
      }
    }
    return MediaType.APPLICATION_JSON;
  }
}
