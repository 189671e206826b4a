package com.example.agreement.domain.model;

/**
 * Row of the agreement's file table.
 */
public record FileRow(String path, String accessRights) {
}
