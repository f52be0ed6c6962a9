package com.sitedigest.core.model;

/** 다이제스트의 페이지 블록. byteLength 는 UTF-8 기준. */
public record DigestBlock(Category category, String path, String text, int byteLength) {}
