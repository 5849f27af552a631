package com.coderocket.prompts;

import java.util.Map;
import java.util.Optional;

/**
 * Prompt texts shipped with the tool, used when no prompt file overrides them.
 */
final class BuiltinPrompts {

    private static final Map<String, String> PROMPTS = Map.of(
            PromptStore.BASE, """
                    You are a professional code reviewer. Analyze the provided code in detail.""",

            "code_review", """
                    # Professional Code Review

                    As a professional code reviewer, analyze the provided code in depth, covering:

                    ## Review dimensions
                    1. **Correctness** - Is the logic right, are there bugs?
                    2. **Quality** - Is the structure clear and the naming consistent?
                    3. **Performance** - Are there performance bottlenecks?
                    4. **Security** - Are there security vulnerabilities?
                    5. **Maintainability** - Is the code readable and extensible?
                    6. **Conventions** - Does the code follow coding conventions?

                    Give concrete improvement suggestions and best practices.""",

            "git_changes", """
                    # Git Changes Review

                    Review the changes in the Git repository, focusing on:

                    ## Focus areas
                    1. **Completeness** - Were all related files changed?
                    2. **Consistency** - Are the changes consistent across files?
                    3. **Impact** - How do the changes affect other modules?
                    4. **Quality** - Implementation quality and security checks
                    5. **Tests** - Are additional tests needed?
                    6. **Documentation** - Does documentation need updating?

                    Give an overall assessment of the changes and improvement suggestions.""",

            "git_commit", """
                    # Git Commit Review

                    As a senior code reviewer, give the Git commit a thorough review:

                    ## Review dimensions
                    1. **Goal** - Does the commit fully achieve its stated goal?
                    2. **Functionality** - Is the implementation correct and complete?
                    3. **Quality** - Structure and conventions of the code
                    4. **Maintainability** - Readability and maintainability
                    5. **Extensibility** - Is the design extensible?

                    Give a detailed review report with improvement suggestions.""",

            "file_review", """
                    # Multi-file Review

                    Assess the overall code quality of the provided files:

                    ## Review dimensions
                    1. **Architecture** - Is the design consistent across files?
                    2. **Dependencies** - Are the dependencies between files sound?
                    3. **Reuse** - Is there duplicated code?
                    4. **Naming** - Are naming conventions consistent?
                    5. **Error handling** - Is error handling consistent?
                    6. **Performance** - Do the files work well together?

                    Give an overall architecture assessment and improvement suggestions.""",

            "review_code", """
                    As a professional code reviewer, analyze the provided code snippet in depth.""",

            "review_changes", """
                    Review the changes in the Git repository.""",

            "review_commit", """
                    Analyze the given Git commit in detail.""",

            "review_files", """
                    Assess the overall code quality of the provided files."""
    );

    private BuiltinPrompts() {}

    static Optional<String> get(String key) {
        return Optional.ofNullable(PROMPTS.get(key));
    }
}
