package com.geico.poc.policyjobs.dto;

import com.geico.poc.policyjobs.errors.JobException;

import java.util.List;
import java.util.Map;

public class JobResponse {
    private List<Map<String, Object>> rows;
    private int rowCount;
    private String error;
    private String sqlState;
    private String detail;
    private String hint;

    public JobResponse() {
    }

    public JobResponse(List<Map<String, Object>> rows) {
        this.rows = rows;
        this.rowCount = rows != null ? rows.size() : 0;
    }

    public static JobResponse error(String message) {
        JobResponse response = new JobResponse();
        response.error = message;
        response.rowCount = 0;
        return response;
    }

    public static JobResponse error(JobException e) {
        JobResponse response = error(e.getMessage());
        response.sqlState = e.getCode().getSqlState();
        response.detail = e.getDetail();
        response.hint = e.getHint();
        return response;
    }

    // Getters and setters
    public List<Map<String, Object>> getRows() {
        return rows;
    }

    public void setRows(List<Map<String, Object>> rows) {
        this.rows = rows;
        this.rowCount = rows != null ? rows.size() : 0;
    }

    public int getRowCount() {
        return rowCount;
    }

    public void setRowCount(int rowCount) {
        this.rowCount = rowCount;
    }

    public String getError() {
        return error;
    }

    public void setError(String error) {
        this.error = error;
    }

    public String getSqlState() {
        return sqlState;
    }

    public void setSqlState(String sqlState) {
        this.sqlState = sqlState;
    }

    public String getDetail() {
        return detail;
    }

    public void setDetail(String detail) {
        this.detail = detail;
    }

    public String getHint() {
        return hint;
    }

    public void setHint(String hint) {
        this.hint = hint;
    }
}
