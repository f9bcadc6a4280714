package com.hivemind.core.workspace;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "hivemind.workspace")
public class WorkspaceProperties {

    /** Default root; the mission command may override it. */
    private String root = "./workspace";
    private Duration reservationTtl = Duration.ofMinutes(5);
    private Duration activityWindow = Duration.ofSeconds(120);
    private String backupDir = ".backups";
    private int maxDiffLines = 100;
    private int newFilePreviewLines = 50;

    public String getRoot() {
        return root;
    }

    public void setRoot(String root) {
        this.root = root;
    }

    public Duration getReservationTtl() {
        return reservationTtl;
    }

    public void setReservationTtl(Duration reservationTtl) {
        this.reservationTtl = reservationTtl;
    }

    public Duration getActivityWindow() {
        return activityWindow;
    }

    public void setActivityWindow(Duration activityWindow) {
        this.activityWindow = activityWindow;
    }

    public String getBackupDir() {
        return backupDir;
    }

    public void setBackupDir(String backupDir) {
        this.backupDir = backupDir;
    }

    public int getMaxDiffLines() {
        return maxDiffLines;
    }

    public void setMaxDiffLines(int maxDiffLines) {
        this.maxDiffLines = maxDiffLines;
    }

    public int getNewFilePreviewLines() {
        return newFilePreviewLines;
    }

    public void setNewFilePreviewLines(int newFilePreviewLines) {
        this.newFilePreviewLines = newFilePreviewLines;
    }
}
