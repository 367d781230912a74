package com.candidateprep.coach.session;

import com.candidateprep.coach.model.CritiqueResult;
import com.candidateprep.coach.model.IterationRecord;
import java.util.ArrayList;
import java.util.List;

/** Append-only practice logs of one session. */
class PracticeSubstate {

    final List<String> questionsAsked = new ArrayList<>();
    final List<String> answersGiven = new ArrayList<>();
    final List<String> followUpsAsked = new ArrayList<>();
    final List<String> followUpAnswers = new ArrayList<>();
    final List<CritiqueResult> critiques = new ArrayList<>();
    final List<IterationRecord> iterationHistory = new ArrayList<>();
}
