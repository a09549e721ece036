package com.github.spud.worksession.domain.project;

import java.util.UUID;

public record ProjectSummary(UUID id, String name, boolean primary) {

}
