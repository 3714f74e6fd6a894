package com.db.ecd.assessment.config;

import com.db.ecd.assessment.constant.IdeaStatus;
import com.db.ecd.assessment.entity.Idea;
import com.db.ecd.assessment.repository.IdeaRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;

@Component
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(name = "assessment.seed-demo-data", havingValue = "true", matchIfMissing = true)
public class DataInitializer implements CommandLineRunner {

    private final IdeaRepository ideaRepository;

    @Override
    public void run(String... args) {
        if (ideaRepository.count() > 0) {
            log.info("Ideas already present, skipping demo data");
            return;
        }

        String[] titles = {
                "AI-Powered Code Review System",
                "Invoice Data Extraction",
                "Customer Churn Early Warning",
                "Contract Clause Summariser",
                "Supplier Risk Monitoring"
        };

        String[] descriptions = {
                "Use an LLM to flag risky changes before human review",
                "Pull line items out of scanned supplier invoices",
                "Predict which accounts are likely to leave next quarter",
                "Summarise non-standard clauses in incoming contracts",
                "Watch news and filings for signs of supplier distress"
        };

        String[] capabilityAreas = {"Generative AI", "Document AI", "Predictive Analytics", "Generative AI", "NLP"};
        String[] businessFunctions = {"Engineering", "Finance", "Sales", "Legal", "Procurement"};
        IdeaStatus[] statuses = {
                IdeaStatus.SUBMITTED,
                IdeaStatus.SUBMITTED,
                IdeaStatus.UNDER_REVIEW,
                IdeaStatus.SUBMITTED,
                IdeaStatus.REJECTED
        };

        for (int i = 0; i < titles.length; i++) {
            Idea idea = new Idea();
            idea.setTitle(titles[i]);
            idea.setDescription(descriptions[i]);
            idea.setExpectedBenefits("20% less manual effort");
            idea.setAiCapabilityArea(capabilityAreas[i]);
            idea.setBusinessFunction(businessFunctions[i]);
            idea.setSubmitterName("demo_user");
            idea.setStatus(statuses[i]);
            idea.setCreatedAt(LocalDateTime.now().minusDays(titles.length - i));
            ideaRepository.save(idea);
        }

        log.info("Database initialized with {} demo ideas", titles.length);
    }
}
