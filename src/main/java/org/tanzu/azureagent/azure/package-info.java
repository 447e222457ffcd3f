/**
 * Azure Resource Manager integration.
 *
 * <p>This package contains:
 * <ul>
 *   <li>{@link org.tanzu.azureagent.azure.AzureManagementClient} – low-level REST client (token, HTTP, paging, JSON).</li>
 *   <li>{@link org.tanzu.azureagent.azure.AzureService} – read-only inventory operations returning typed records.</li>
 * </ul>
 *
 * <p>VMs are addressed by friendly name and resolved to resource IDs internally.
 */
package org.tanzu.azureagent.azure;
