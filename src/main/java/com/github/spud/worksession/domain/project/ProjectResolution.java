package com.github.spud.worksession.domain.project;

import java.util.UUID;

public record ProjectResolution(UUID projectId, ResolutionLevel level) {

}
