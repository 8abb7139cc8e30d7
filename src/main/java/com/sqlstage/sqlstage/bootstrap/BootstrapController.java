package com.sqlstage.sqlstage.bootstrap;

import com.sqlstage.sqlstage.asset.AssetCatalog;
import com.sqlstage.sqlstage.asset.AssetResolver;
import com.sqlstage.sqlstage.asset.SourceDescriptor;
import com.sqlstage.sqlstage.bootstrap.BootstrapModels.BootstrapReport;
import com.sqlstage.sqlstage.bootstrap.BootstrapModels.BootstrapRequest;
import com.sqlstage.sqlstage.bootstrap.BootstrapModels.SourceSummary;
import com.sqlstage.sqlstage.cache.CacheUnavailableException;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Exposes on-demand bootstrap runs and the staged assets they produce.
 */
@RestController
@RequestMapping("/api/bootstrap")
public class BootstrapController {

    private final BootstrapDriver bootstrapDriver;
    private final AssetCatalog assetCatalog;
    private final AssetResolver assetResolver;

    public BootstrapController(BootstrapDriver bootstrapDriver, AssetCatalog assetCatalog, AssetResolver assetResolver) {
        this.bootstrapDriver = bootstrapDriver;
        this.assetCatalog = assetCatalog;
        this.assetResolver = assetResolver;
    }

    /**
     * Runs one bootstrap over the requested engines and datasets; omitted options use configured defaults.
     */
    @PostMapping("/run")
    public ResponseEntity<BootstrapReport> run(@RequestBody(required = false) BootstrapRequest request) {
        try {
            return ResponseEntity.ok(bootstrapDriver.run(request));
        } catch (IllegalArgumentException ex) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, ex.getMessage(), ex);
        } catch (CacheUnavailableException ex) {
            throw new ResponseStatusException(HttpStatus.INTERNAL_SERVER_ERROR, ex.getMessage(), ex);
        }
    }

    @GetMapping("/sources")
    public ResponseEntity<List<SourceSummary>> sources() {
        List<SourceSummary> summaries = new ArrayList<>();
        assetCatalog.sources().forEach((dataset, source) -> summaries.add(summarize(dataset, source)));
        return ResponseEntity.ok(summaries);
    }

    /**
     * Returns the staged question file of a dataset.
     */
    @GetMapping(value = "/questions/{dataset}", produces = MediaType.TEXT_PLAIN_VALUE)
    public ResponseEntity<String> questions(@PathVariable String dataset) {
        Path path = assetResolver.questionsPath(dataset)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND,
                        "No staged questions for dataset " + dataset));
        try {
            return ResponseEntity.ok(Files.readString(path, StandardCharsets.UTF_8));
        } catch (IOException ex) {
            throw new ResponseStatusException(HttpStatus.INTERNAL_SERVER_ERROR, "Failed to read " + path, ex);
        }
    }

    private SourceSummary summarize(String dataset, SourceDescriptor source) {
        if (source instanceof SourceDescriptor.DirectSql direct) {
            return new SourceSummary(dataset, "direct-sql", direct.stagedName(), direct.url());
        }
        if (source instanceof SourceDescriptor.ZipMember zip) {
            return new SourceSummary(dataset, "zip", zip.stagedName(), zip.url() + "!" + zip.memberPath());
        }
        SourceDescriptor.BundleMember member = (SourceDescriptor.BundleMember) source;
        return new SourceSummary(dataset, "bundle", member.stagedName(), member.bundleId() + ":" + member.key());
    }
}
