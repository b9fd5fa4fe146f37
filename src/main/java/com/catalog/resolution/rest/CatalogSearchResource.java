package com.catalog.resolution.rest;

import com.catalog.resolution.api.CatalogSearchService;
import com.catalog.resolution.api.InvalidArgumentException;
import com.catalog.resolution.api.InvalidQueryException;
import com.catalog.resolution.api.ResolutionOptions;
import com.catalog.resolution.api.ResolvedMatch;
import com.catalog.resolution.core.model.CatalogEntity;
import com.catalog.resolution.core.model.EntityKind;
import com.catalog.resolution.rest.dto.CatalogEntityResponse;
import com.catalog.resolution.rest.dto.ErrorResponse;
import com.catalog.resolution.rest.dto.SearchMatchResponse;
import com.catalog.resolution.store.StoreUnavailableException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.parameters.Parameter;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * REST resource for catalog search.
 *
 * <p>Search endpoints answer with a JSON array, empty when nothing matches. Lookup and
 * approval answer with a single entity, or 404. Caller errors are 400, an unreachable
 * store is 503.</p>
 */
@Path("/api/v1/catalog")
@Produces(MediaType.APPLICATION_JSON)
@ApplicationScoped
@Tag(name = "Catalog Search", description = "Resolve free text to exercises and foods")
public class CatalogSearchResource {
    private static final Logger log = LoggerFactory.getLogger(CatalogSearchResource.class);

    static final int MAX_LIMIT = 100;

    private final CatalogSearchService searchService;

    @Inject
    public CatalogSearchResource(CatalogSearchService searchService) {
        this.searchService = searchService;
    }

    /**
     * Searches the exercise catalog.
     *
     * GET /api/v1/catalog/exercises/search
     */
    @GET
    @Path("/exercises/search")
    @Operation(summary = "Search exercises",
            description = "Matches the query against exercise names and aliases, best match first.")
    @APIResponse(responseCode = "200", description = "Ranked matches, possibly empty")
    @APIResponse(responseCode = "400", description = "Empty query or out-of-range parameter")
    @APIResponse(responseCode = "503", description = "Catalog store unavailable")
    public Response searchExercises(
            @Parameter(description = "Free-text query") @QueryParam("q") String query,
            @Parameter(description = "Alias locale") @QueryParam("locale") @DefaultValue("en") String locale,
            @Parameter(description = "Maximum results, 1-100") @QueryParam("limit") @DefaultValue("25") int limit,
            @Parameter(description = "Score floor in [0,1]") @QueryParam("minScore") @DefaultValue("0") double minScore) {
        return search(EntityKind.EXERCISE, "/api/v1/catalog/exercises/search", query, locale, limit, minScore);
    }

    /**
     * Searches the food catalog.
     *
     * GET /api/v1/catalog/foods/search
     */
    @GET
    @Path("/foods/search")
    @Operation(summary = "Search foods",
            description = "Matches the query against food names and aliases, best match first.")
    @APIResponse(responseCode = "200", description = "Ranked matches, possibly empty")
    @APIResponse(responseCode = "400", description = "Empty query or out-of-range parameter")
    @APIResponse(responseCode = "503", description = "Catalog store unavailable")
    public Response searchFoods(
            @Parameter(description = "Free-text query") @QueryParam("q") String query,
            @Parameter(description = "Alias locale") @QueryParam("locale") @DefaultValue("en") String locale,
            @Parameter(description = "Maximum results, 1-100") @QueryParam("limit") @DefaultValue("25") int limit,
            @Parameter(description = "Score floor in [0,1]") @QueryParam("minScore") @DefaultValue("0") double minScore) {
        return search(EntityKind.FOOD, "/api/v1/catalog/foods/search", query, locale, limit, minScore);
    }

    /**
     * Looks up a food by product barcode.
     *
     * GET /api/v1/catalog/foods/by_barcode
     */
    @GET
    @Path("/foods/by_barcode")
    @Operation(summary = "Find a food by barcode",
            description = "Returns the active food carrying the barcode. Whitespace in the barcode is ignored.")
    @APIResponse(responseCode = "200", description = "The food")
    @APIResponse(responseCode = "400", description = "Barcode is not 8 to 14 digits")
    @APIResponse(responseCode = "404", description = "No active food carries the barcode")
    @APIResponse(responseCode = "503", description = "Catalog store unavailable")
    public Response findFoodByBarcode(
            @Parameter(description = "EAN-8 to GTIN-14 barcode") @QueryParam("barcode") String barcode) {
        String path = "/api/v1/catalog/foods/by_barcode";
        return entityResponse(path, "barcode", () -> searchService.findFoodByBarcode(barcode),
                "No active food with barcode " + barcode);
    }

    /**
     * Lists a user-submitted food in public search.
     *
     * POST /api/v1/catalog/foods/approve
     */
    @POST
    @Path("/foods/approve")
    @Operation(summary = "Approve a food",
            description = "Makes a private food visible in food search. Approving a public food changes nothing.")
    @APIResponse(responseCode = "200", description = "The approved food")
    @APIResponse(responseCode = "400", description = "Missing food id")
    @APIResponse(responseCode = "404", description = "Unknown food id")
    @APIResponse(responseCode = "503", description = "Catalog store unavailable")
    public Response approveFood(
            @Parameter(description = "Id of the food to approve") @QueryParam("food_id") String foodId) {
        String path = "/api/v1/catalog/foods/approve";
        return entityResponse(path, "approve", () -> searchService.approveFood(foodId),
                "No food with id " + foodId);
    }

    private Response entityResponse(String path, String operation, Supplier<Optional<CatalogEntity>> call,
                                    String notFoundMessage) {
        try {
            return call.get()
                    .map(entity -> Response.ok(CatalogEntityResponse.from(entity)).build())
                    .orElseGet(() -> error(Response.Status.NOT_FOUND, notFoundMessage, path));
        } catch (InvalidArgumentException e) {
            return error(Response.Status.BAD_REQUEST, e.getMessage(), path);
        } catch (StoreUnavailableException e) {
            log.warn("{}.storeUnavailable error={}", operation, e.getMessage());
            return error(Response.Status.SERVICE_UNAVAILABLE, "Catalog store is unavailable. Retry later.", path);
        } catch (Exception e) {
            log.error("{}.failed error={}", operation, e.getMessage(), e);
            return error(Response.Status.INTERNAL_SERVER_ERROR,
                    "An internal error occurred. Check server logs for details.", path);
        }
    }

    private Response search(EntityKind kind, String path, String query, String locale, int limit, double minScore) {
        try {
            if (limit < 1 || limit > MAX_LIMIT) {
                throw new InvalidArgumentException("limit must be between 1 and " + MAX_LIMIT + ", got " + limit);
            }
            ResolutionOptions options = ResolutionOptions.builder(
                            searchService.resolverFor(kind).getDefaultOptions())
                    .locale(locale)
                    .maxResults(limit)
                    .minScore(minScore)
                    .build();

            List<ResolvedMatch> matches = searchService.search(kind, query, options);
            List<SearchMatchResponse> body = matches.stream().map(SearchMatchResponse::from).toList();
            return Response.ok(body).build();

        } catch (InvalidQueryException | InvalidArgumentException e) {
            return error(Response.Status.BAD_REQUEST, e.getMessage(), path);
        } catch (StoreUnavailableException e) {
            log.warn("search.storeUnavailable kind={} error={}", kind, e.getMessage());
            return error(Response.Status.SERVICE_UNAVAILABLE, "Catalog store is unavailable. Retry later.", path);
        } catch (Exception e) {
            log.error("search.failed kind={} error={}", kind, e.getMessage(), e);
            return error(Response.Status.INTERNAL_SERVER_ERROR,
                    "An internal error occurred. Check server logs for details.", path);
        }
    }

    private static Response error(Response.Status status, String message, String path) {
        return Response.status(status).entity(ErrorResponse.of(status, message, path)).build();
    }
}
