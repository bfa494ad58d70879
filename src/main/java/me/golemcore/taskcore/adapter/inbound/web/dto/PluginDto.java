package me.golemcore.taskcore.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PluginDto {

    private String name;
    private String displayName;
    private String description;
    private String version;
    private String author;
    private String source;
    private List<String> actions;
    private List<String> tools;
    private List<String> requiredEnv;
    private List<String> missingEnv;
    private boolean enabled;
    private boolean ready;
    private Instant loadedAt;
}
