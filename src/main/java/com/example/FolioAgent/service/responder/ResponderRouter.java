package com.example.FolioAgent.service.responder;

import com.example.FolioAgent.model.Intent;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Maps each intent to exactly one responder.
 */
@Component
@RequiredArgsConstructor
public class ResponderRouter {

    private final EducationResponder educationResponder;
    private final ExperienceResponder experienceResponder;
    private final PersonalProjectResponder personalProjectResponder;
    private final SkillsResponder skillsResponder;
    private final CaseStudyResponder caseStudyResponder;
    private final ProjectTourResponder projectTourResponder;
    private final GeneralResponder generalResponder;

    public PortfolioResponder route(Intent intent) {
        return switch (intent) {
            case EDUCATION -> educationResponder;
            case EXPERIENCE -> experienceResponder;
            case PERSONAL_PROJECT -> personalProjectResponder;
            case SKILLS -> skillsResponder;
            case CASE_STUDY -> caseStudyResponder;
            case PROJECT_TOUR -> projectTourResponder;
            case GENERAL -> generalResponder;
        };
    }
}
