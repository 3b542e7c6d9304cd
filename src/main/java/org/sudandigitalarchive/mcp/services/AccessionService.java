package org.sudandigitalarchive.mcp.services;

import java.util.List;

import org.sudandigitalarchive.mcp.api.McpTool;
import org.sudandigitalarchive.mcp.api.Param;
import org.sudandigitalarchive.mcp.client.ApiException;
import org.sudandigitalarchive.mcp.client.SdaClient;
import org.sudandigitalarchive.mcp.model.JsonOutput;
import org.sudandigitalarchive.mcp.model.ToolOutput;
import org.sudandigitalarchive.mcp.model.request.AccessionPatch;
import org.sudandigitalarchive.mcp.model.request.AccessionQuery;
import org.sudandigitalarchive.mcp.model.response.AccessionDetail;
import org.sudandigitalarchive.mcp.model.response.AccessionPage;
import org.sudandigitalarchive.mcp.normalize.ArgumentNormalizer;

/**
 * Tools for browsing and editing archival records (accessions).
 */
public class AccessionService {
    private static final String PAGE = "Page number to fetch, or -1 for the archive default";
    private static final String PER_PAGE = "Number of accessions per page, or -1 for the archive default";
    private static final String LANG = "Metadata language to match: 'english', 'arabic', or \"\" for any";
    private static final String SUBJECTS = "Subject ids to filter by, or [] for no subject filter";
    private static final String INCLUSIVE = "If true, match accessions with any of the subjects instead of all of them";
    private static final String QUERY_TERM = "Free-text search term, or \"\" for none";
    private static final String URL_FILTER = "Only accessions whose seed URL contains this text, or \"\" for none";
    private static final String DATE_FROM = "Earliest metadata date (YYYY-MM-DD), or \"\" for no lower bound";
    private static final String DATE_TO = "Latest metadata date (YYYY-MM-DD), or \"\" for no upper bound";

    private final SdaClient client;

    /**
     * Creates a new AccessionService
     *
     * @param client the archive client
     */
    public AccessionService(SdaClient client) {
        this.client = client;
    }

    @McpTool(description = """
        List public accessions in the Sudan Digital Archive, with optional filters.

        Every parameter must be passed; use -1, "" or [] to leave a filter unspecified.
        Returns a page of accessions with pagination information.""",
        outputType = JsonOutput.class, responseType = AccessionPage.class)
    public ToolOutput listAccessions(
            @Param(value = PAGE, unset = "-1") int page,
            @Param(value = PER_PAGE, unset = "-1") int perPage,
            @Param(value = LANG, unset = "") String lang,
            @Param(value = SUBJECTS, unset = "[]") List<String> metadataSubjects,
            @Param(value = INCLUSIVE, unset = "false") boolean metadataSubjectsInclusiveFilter,
            @Param(value = QUERY_TERM, unset = "") String queryTerm,
            @Param(value = URL_FILTER, unset = "") String urlFilter,
            @Param(value = DATE_FROM, unset = "") String dateFrom,
            @Param(value = DATE_TO, unset = "") String dateTo) throws ApiException {
        final AccessionQuery query = ArgumentNormalizer.accessionQuery(page, perPage, lang, metadataSubjects,
            metadataSubjectsInclusiveFilter, queryTerm, urlFilter, dateFrom, dateTo);
        return new JsonOutput(client.listAccessions(query));
    }

    @McpTool(description = """
        List private accessions in the Sudan Digital Archive, with optional filters.
        Requires an API key allowed to see private records.

        Every parameter must be passed; use -1, "" or [] to leave a filter unspecified.
        Returns a page of accessions with pagination information.""",
        outputType = JsonOutput.class, responseType = AccessionPage.class)
    public ToolOutput listPrivateAccessions(
            @Param(value = PAGE, unset = "-1") int page,
            @Param(value = PER_PAGE, unset = "-1") int perPage,
            @Param(value = LANG, unset = "") String lang,
            @Param(value = SUBJECTS, unset = "[]") List<String> metadataSubjects,
            @Param(value = INCLUSIVE, unset = "false") boolean metadataSubjectsInclusiveFilter,
            @Param(value = QUERY_TERM, unset = "") String queryTerm,
            @Param(value = URL_FILTER, unset = "") String urlFilter,
            @Param(value = DATE_FROM, unset = "") String dateFrom,
            @Param(value = DATE_TO, unset = "") String dateTo) throws ApiException {
        final AccessionQuery query = ArgumentNormalizer.accessionQuery(page, perPage, lang, metadataSubjects,
            metadataSubjectsInclusiveFilter, queryTerm, urlFilter, dateFrom, dateTo);
        return new JsonOutput(client.listPrivateAccessions(query));
    }

    @McpTool(description = """
        Get a single public accession by id, with the download URL of its web archive (WACZ).""",
        outputType = JsonOutput.class, responseType = AccessionDetail.class)
    public ToolOutput getAccession(
            @Param("Accession id") String id) throws ApiException {
        return new JsonOutput(client.getAccession(ArgumentNormalizer.identifier("id", id)));
    }

    @McpTool(description = """
        Get a single private accession by id, with the download URL of its web archive (WACZ).""",
        outputType = JsonOutput.class, responseType = AccessionDetail.class)
    public ToolOutput getPrivateAccession(
            @Param("Accession id") String id) throws ApiException {
        return new JsonOutput(client.getPrivateAccession(ArgumentNormalizer.identifier("id", id)));
    }

    @McpTool(description = """
        Update the metadata or visibility of an accession. Only the fields given a value are changed;
        pass "" or [] to leave a field as it is. At least one field must be given.

        Returns the updated accession.""",
        outputType = JsonOutput.class, responseType = AccessionDetail.class)
    public ToolOutput updateAccession(
            @Param("Accession id") String id,
            @Param(value = "New title, or \"\" to keep", unset = "") String metadataTitle,
            @Param(value = "New description, or \"\" to keep", unset = "") String metadataDescription,
            @Param(value = "New metadata date/time, or \"\" to keep", unset = "") String metadataTime,
            @Param(value = "Language of the metadata being written: 'english' or 'arabic', or \"\" to keep", unset = "")
                String metadataLanguage,
            @Param(value = "Replacement list of subject ids, or [] to keep", unset = "[]") List<String> metadataSubjects,
            @Param(value = "'public' or 'private', or \"\" to keep", unset = "") String visibility) throws ApiException {
        final String accessionId = ArgumentNormalizer.identifier("id", id);
        final AccessionPatch patch = ArgumentNormalizer.accessionPatch(metadataTitle, metadataDescription,
            metadataTime, metadataLanguage, metadataSubjects, visibility);
        return new JsonOutput(client.updateAccession(accessionId, patch));
    }
}
