package org.sudandigitalarchive.mcp.services;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sudandigitalarchive.mcp.api.McpTool;
import org.sudandigitalarchive.mcp.api.Param;
import org.sudandigitalarchive.mcp.client.ApiException;
import org.sudandigitalarchive.mcp.client.SdaClient;
import org.sudandigitalarchive.mcp.model.JsonOutput;
import org.sudandigitalarchive.mcp.model.MetadataLanguage;
import org.sudandigitalarchive.mcp.model.StatusOutput;
import org.sudandigitalarchive.mcp.model.ToolOutput;
import org.sudandigitalarchive.mcp.model.request.NewSubject;
import org.sudandigitalarchive.mcp.model.response.Subject;
import org.sudandigitalarchive.mcp.model.response.SubjectPage;
import org.sudandigitalarchive.mcp.normalize.ArgumentNormalizer;

/**
 * Tools for the metadata subjects used to classify accessions.
 */
public class SubjectService {
    private static final Logger log = LoggerFactory.getLogger(SubjectService.class);

    private final SdaClient client;

    public SubjectService(SdaClient client) {
        this.client = client;
    }

    @McpTool(description = """
        List metadata subjects.

        Returns a page of subjects with pagination information.""",
        outputType = JsonOutput.class, responseType = SubjectPage.class)
    public ToolOutput listSubjects(
            @Param(value = "Page number to fetch, or -1 for the archive default", unset = "-1") int page,
            @Param(value = "Number of subjects per page, or -1 for the archive default", unset = "-1") int perPage)
            throws ApiException {
        return new JsonOutput(client.listSubjects(ArgumentNormalizer.page(page, perPage)));
    }

    @McpTool(description = """
        Create a metadata subject.

        Returns the created subject, including the id assigned by the archive.""",
        outputType = JsonOutput.class, responseType = Subject.class)
    public ToolOutput createSubject(
            @Param("Subject label, e.g. 'Health'") String label,
            @Param(value = "'public' or 'private', or \"\" for the archive default", unset = "") String visibility,
            @Param(value = "Language of the label: 'english' or 'arabic', or \"\" for the archive default", unset = "")
                String lang) throws ApiException {
        final NewSubject subject = ArgumentNormalizer.newSubject(label, visibility, lang);
        final Subject created = client.createSubject(subject);
        log.info("Created subject {}", created.id());
        return new JsonOutput(created);
    }

    @McpTool(description = """
        Delete a metadata subject by id. Deleting a subject that does not exist is an error.""",
        outputType = StatusOutput.class)
    public ToolOutput deleteSubject(
            @Param("Subject id") String id,
            @Param(value = "Language of the subject: 'english' or 'arabic', or \"\" if not needed", unset = "")
                String lang) throws ApiException {
        final String subjectId = ArgumentNormalizer.identifier("id", id);
        final MetadataLanguage language = ArgumentNormalizer.language("lang", lang);
        client.deleteSubject(subjectId, language);
        log.info("Deleted subject {}", subjectId);
        return StatusOutput.ok("Subject " + subjectId + " deleted");
    }
}
