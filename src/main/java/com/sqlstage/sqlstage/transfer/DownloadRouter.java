package com.sqlstage.sqlstage.transfer;

import com.sqlstage.sqlstage.config.SqlStageProperties;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.nio.file.Path;
import java.util.List;

/**
 * Picks the plain or the interactive downloader from the shape of the URL.
 */
@Component
public class DownloadRouter {

    private final TransferService transferService;
    private final InteractiveHostDownloader interactiveHostDownloader;
    private final List<String> interactiveHosts;

    public DownloadRouter(TransferService transferService,
                          InteractiveHostDownloader interactiveHostDownloader,
                          SqlStageProperties properties) {
        this.transferService = transferService;
        this.interactiveHostDownloader = interactiveHostDownloader;
        this.interactiveHosts = List.copyOf(properties.getTransfer().getInteractiveHosts());
    }

    public Path download(String url, Path destination, boolean force) {
        if (isInteractiveHost(url)) {
            return interactiveHostDownloader.download(url, destination, force);
        }
        return transferService.fetch(url, destination, force);
    }

    boolean isInteractiveHost(String url) {
        String host;
        try {
            host = URI.create(url).getHost();
        } catch (IllegalArgumentException ex) {
            return false;
        }
        if (host == null) {
            return false;
        }
        return interactiveHosts.stream().anyMatch(host::equalsIgnoreCase);
    }
}
