package com.example.compliance.model;

public record ScoredChunk(ProcedureChunk chunk, double score) {
}
