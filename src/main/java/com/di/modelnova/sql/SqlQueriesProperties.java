package com.di.modelnova.sql;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * SQL queries loaded from sql-queries.yml (modelnova.sql.*).
 * JDBC stores never inline SQL; they use these named queries.
 */
@Component
@ConfigurationProperties(prefix = "modelnova.sql")
public class SqlQueriesProperties {

    private Versions versions = new Versions();
    private Runs runs = new Runs();
    private Predictions predictions = new Predictions();
    private Findings findings = new Findings();
    private AbTests abTests = new AbTests();
    private Alerts alerts = new Alerts();

    public Versions getVersions() { return versions; }
    public void setVersions(Versions versions) { this.versions = versions; }
    public Runs getRuns() { return runs; }
    public void setRuns(Runs runs) { this.runs = runs; }
    public Predictions getPredictions() { return predictions; }
    public void setPredictions(Predictions predictions) { this.predictions = predictions; }
    public Findings getFindings() { return findings; }
    public void setFindings(Findings findings) { this.findings = findings; }
    public AbTests getAbTests() { return abTests; }
    public void setAbTests(AbTests abTests) { this.abTests = abTests; }
    public Alerts getAlerts() { return alerts; }
    public void setAlerts(Alerts alerts) { this.alerts = alerts; }

    public static class Versions {
        private String insert;
        private String updateStatus;
        private String findByVersionId;
        private String findByModelId;
        private String findByStatus;
        public String getInsert() { return insert; }
        public void setInsert(String insert) { this.insert = insert; }
        public String getUpdateStatus() { return updateStatus; }
        public void setUpdateStatus(String updateStatus) { this.updateStatus = updateStatus; }
        public String getFindByVersionId() { return findByVersionId; }
        public void setFindByVersionId(String findByVersionId) { this.findByVersionId = findByVersionId; }
        public String getFindByModelId() { return findByModelId; }
        public void setFindByModelId(String findByModelId) { this.findByModelId = findByModelId; }
        public String getFindByStatus() { return findByStatus; }
        public void setFindByStatus(String findByStatus) { this.findByStatus = findByStatus; }
    }

    public static class Runs {
        private String update;
        private String insert;
        private String findByRunId;
        private String findRecent;
        private String findRecentByFamily;
        public String getUpdate() { return update; }
        public void setUpdate(String update) { this.update = update; }
        public String getInsert() { return insert; }
        public void setInsert(String insert) { this.insert = insert; }
        public String getFindByRunId() { return findByRunId; }
        public void setFindByRunId(String findByRunId) { this.findByRunId = findByRunId; }
        public String getFindRecent() { return findRecent; }
        public void setFindRecent(String findRecent) { this.findRecent = findRecent; }
        public String getFindRecentByFamily() { return findRecentByFamily; }
        public void setFindRecentByFamily(String findRecentByFamily) { this.findRecentByFamily = findRecentByFamily; }
    }

    public static class Predictions {
        private String insert;
        private String findRecent;
        public String getInsert() { return insert; }
        public void setInsert(String insert) { this.insert = insert; }
        public String getFindRecent() { return findRecent; }
        public void setFindRecent(String findRecent) { this.findRecent = findRecent; }
    }

    public static class Findings {
        private String insert;
        private String findByModel;
        private String findByModelAndType;
        public String getInsert() { return insert; }
        public void setInsert(String insert) { this.insert = insert; }
        public String getFindByModel() { return findByModel; }
        public void setFindByModel(String findByModel) { this.findByModel = findByModel; }
        public String getFindByModelAndType() { return findByModelAndType; }
        public void setFindByModelAndType(String findByModelAndType) { this.findByModelAndType = findByModelAndType; }
    }

    public static class AbTests {
        private String insert;
        private String update;
        private String overwrite;
        private String findById;
        private String findByStatus;
        private String findRecent;
        public String getInsert() { return insert; }
        public void setInsert(String insert) { this.insert = insert; }
        public String getUpdate() { return update; }
        public void setUpdate(String update) { this.update = update; }
        public String getOverwrite() { return overwrite; }
        public void setOverwrite(String overwrite) { this.overwrite = overwrite; }
        public String getFindById() { return findById; }
        public void setFindById(String findById) { this.findById = findById; }
        public String getFindByStatus() { return findByStatus; }
        public void setFindByStatus(String findByStatus) { this.findByStatus = findByStatus; }
        public String getFindRecent() { return findRecent; }
        public void setFindRecent(String findRecent) { this.findRecent = findRecent; }
    }

    public static class Alerts {
        private String insert;
        private String markResolved;
        private String findById;
        private String find;
        public String getInsert() { return insert; }
        public void setInsert(String insert) { this.insert = insert; }
        public String getMarkResolved() { return markResolved; }
        public void setMarkResolved(String markResolved) { this.markResolved = markResolved; }
        public String getFindById() { return findById; }
        public void setFindById(String findById) { this.findById = findById; }
        public String getFind() { return find; }
        public void setFind(String find) { this.find = find; }
    }
}
