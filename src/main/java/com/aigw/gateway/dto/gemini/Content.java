package com.aigw.gateway.dto.gemini;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Gemini 内容块：单一角色下的有序 Part 列表
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Content {

    public static final String ROLE_USER = "user";
    public static final String ROLE_MODEL = "model";

    private String role;
    private List<Part> parts = new ArrayList<>();

    public static Content user(List<Part> parts) {
        return new Content(ROLE_USER, new ArrayList<>(parts));
    }

    public static Content model(List<Part> parts) {
        return new Content(ROLE_MODEL, new ArrayList<>(parts));
    }
}
