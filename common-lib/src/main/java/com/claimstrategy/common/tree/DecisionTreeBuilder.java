package com.claimstrategy.common.tree;

import com.claimstrategy.common.model.CaseStrength;
import com.claimstrategy.common.model.DamagesRange;

import static com.claimstrategy.common.tree.TreeNode.branch;
import static com.claimstrategy.common.tree.TreeNode.leaf;

/**
 * Builds the procedural decision tree of a claim for explanation and visualization.
 *
 * <h3>Shape</h3>
 * <pre>
 *   File Complaint
 *   ├── Defendant Answers (0.85)
 *   │   └── Discovery Phase
 *   │       ├── Early Settlement (Pre-Discovery) (0.25)
 *   │       ├── Motion for Summary Judgment (cs&gt;7 ? 0.6 : 0.3)
 *   │       │   ├── MSJ Granted (cs&gt;7 ? 0.5 : 0.2)
 *   │       │   └── MSJ Denied  (cs&gt;7 ? 0.5 : 0.8)
 *   │       │       ├── Settlement (Pre-Trial) (0.6)
 *   │       │       └── Go to Trial (0.4)
 *   │       ├── Settlement (Post-Discovery) (0.45)
 *   │       └── Trial Preparation (0.30)
 *   │           ├── Trial Win  (cs/10 x 0.75)
 *   │           ├── Trial Loss ((10-cs)/10 x 0.25)
 *   │           └── Last-Minute Settlement (0.30)
 *   └── Defendant Defaults (0.15)
 * </pre>
 *
 * <p>Branch probabilities are hand-specified conditional rates. They are
 * NOT the probabilities of {@link com.claimstrategy.common.scenario.ScenarioCatalog},
 * which drive the numeric path; this tree never feeds expected values or simulation.
 * Zero-probability branches stay in the tree.
 *
 * <p>Deterministic and side-effect free.
 */
public final class DecisionTreeBuilder {

    public static final String ROOT_ACTION = "File Complaint";

    public TreeNode build(DamagesRange damages, CaseStrength strength) {
        double cs = strength.fraction();
        boolean strong = strength.isStrong();

        TreeNode msjDenied = branch("MSJ Denied", strong ? 0.5 : 0.8, 5_000, 180,
            leaf("Settlement (Pre-Trial)", 0.6, damages.recommended() * 0.80, 8_000, 270),
            new TreeNode("Go to Trial", 0.4, 15_000, 365, null, null));

        TreeNode summaryJudgment = branch("Motion for Summary Judgment", strong ? 0.6 : 0.3, 5_000, 180,
            leaf("MSJ Granted", strong ? 0.5 : 0.2, damages.aggressive(), 5_000, 180),
            msjDenied);

        TreeNode trialPreparation = branch("Trial Preparation", 0.30, 15_000, 365,
            leaf("Trial Win", cs * 0.75, damages.aggressive(), 15_000, 365),
            leaf("Trial Loss", (1.0 - cs) * 0.25, 0.0, 15_000, 365),
            leaf("Last-Minute Settlement", 0.30, damages.recommended() * 0.90, 12_000, 330));

        TreeNode discovery = branch("Discovery Phase", 1.0, 2_000, 120,
            leaf("Early Settlement (Pre-Discovery)", 0.25, damages.conservative() * 0.65, 2_500, 90),
            summaryJudgment,
            leaf("Settlement (Post-Discovery)", 0.45, damages.recommended() * 0.85, 8_000, 240),
            trialPreparation);

        return branch(ROOT_ACTION, 1.0, 500, 0,
            branch("Defendant Answers", 0.85, 0, 30, discovery),
            leaf("Defendant Defaults", 0.15, damages.aggressive(), 1_000, 60));
    }
}
