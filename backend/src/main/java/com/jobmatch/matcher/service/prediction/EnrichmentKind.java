package com.jobmatch.matcher.service.prediction;

import com.jobmatch.matcher.dto.prediction.RankedPosting;
import com.jobmatch.matcher.service.generation.BilingualSectionParser.BilingualText;

/** The generated texts attached to every displayed posting, each backed by a prompt template. */
public enum EnrichmentKind {
  COVER_LETTER("cover-letter") {
    @Override
    void apply(RankedPosting posting, BilingualText text) {
      posting.setCoverLetterEn(text.getEnglish());
      posting.setCoverLetterFr(text.getFrench());
    }
  },
  MISSING_SKILLS("missing-skills") {
    @Override
    void apply(RankedPosting posting, BilingualText text) {
      posting.setMissingSkillsEn(text.getEnglish());
      posting.setMissingSkillsFr(text.getFrench());
    }
  },
  MATCHING_SKILLS("matching-skills") {
    @Override
    void apply(RankedPosting posting, BilingualText text) {
      posting.setMatchingSkillsEn(text.getEnglish());
      posting.setMatchingSkillsFr(text.getFrench());
    }
  };

  private final String templateName;

  EnrichmentKind(String templateName) {
    this.templateName = templateName;
  }

  public String getTemplateName() {
    return templateName;
  }

  abstract void apply(RankedPosting posting, BilingualText text);
}
