/*
 * Copyright (C) 2026 ACME Delivery Services
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.acme.delivery.app;

import com.acme.delivery.replication.pg.DatabaseEndpoint;
import com.acme.delivery.replication.pg.PostgresConnectionFactory;
import com.acme.delivery.replication.pg.ReusableConnectionProvider;
import java.nio.file.Path;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Command line entry point exporting the operational reports to CSV files.
 */
@Command(
  name = "analytics-report",
  mixinStandardHelpOptions = true,
  description = "ACME Delivery Services analytics reports",
  subcommands = {
    ReportCommand.OpenOrders.class,
    ReportCommand.TopDeliveryDates.class,
    ReportCommand.PendingItems.class,
    ReportCommand.TopCustomers.class
  })
public final class ReportCommand implements Callable<Integer> {

  /**
   * Produces the rows of a report.
   */
  @FunctionalInterface
  interface ReportSource {
    List<Map<String, Object>> fetch(Report report) throws SQLException;
  }

  @Spec
  CommandSpec spec;

  private final ReportSource source;
  private final CsvExporter exporter = new CsvExporter();

  public ReportCommand() {
    this(ReportCommand::queryAnalyticsStore);
  }

  ReportCommand(ReportSource source) {
    this.source = Objects.requireNonNull(source, "source");
  }

  public static void main(String[] args) {
    System.exit(new CommandLine(new ReportCommand()).execute(args));
  }

  @Override
  public Integer call() {
    throw new CommandLine.ParameterException(spec.commandLine(), "Missing required subcommand");
  }

  int export(Report report, Path output, CommandSpec command) {
    try {
      List<Map<String, Object>> rows = source.fetch(report);
      int written = exporter.export(rows, output);
      command.commandLine().getOut().println("Exported " + written + " records to " + output);
      return 0;
    } catch (Exception e) {
      command.commandLine().getErr().println("Error: " + e.getMessage());
      return 1;
    }
  }

  private static List<Map<String, Object>> queryAnalyticsStore(Report report) throws SQLException {
    DatabaseEndpoint endpoint = ReplicationAppConfig.fromEnv().analytics();
    PostgresConnectionFactory factory = new PostgresConnectionFactory();
    try (ReusableConnectionProvider connections =
           ReusableConnectionProvider.of(factory, endpoint, factory.connectWithRetry(endpoint), true)) {
      return report.run(new ReportQueries(connections));
    }
  }

  abstract static class ExportCommand implements Callable<Integer> {

    @ParentCommand
    ReportCommand parent;

    @Spec
    CommandSpec spec;

    abstract Report report();

    abstract Path output();

    @Override
    public Integer call() {
      return parent.export(report(), output(), spec);
    }
  }

  @Command(name = "open-orders", description = "Export open orders by delivery date and status")
  static final class OpenOrders extends ExportCommand {

    @Option(names = "--output", description = "Output CSV file name", defaultValue = "open_orders.csv")
    Path output;

    @Override
    Report report() {
      return Report.OPEN_ORDERS;
    }

    @Override
    Path output() {
      return output;
    }
  }

  @Command(name = "top-delivery-dates", description = "Export top 3 delivery dates with most open orders")
  static final class TopDeliveryDates extends ExportCommand {

    @Option(names = "--output", description = "Output CSV file name", defaultValue = "top_delivery_dates.csv")
    Path output;

    @Override
    Report report() {
      return Report.TOP_DELIVERY_DATES;
    }

    @Override
    Path output() {
      return output;
    }
  }

  @Command(name = "pending-items", description = "Export pending items by product ID")
  static final class PendingItems extends ExportCommand {

    @Option(names = "--output", description = "Output CSV file name", defaultValue = "pending_items.csv")
    Path output;

    @Override
    Report report() {
      return Report.PENDING_ITEMS;
    }

    @Override
    Path output() {
      return output;
    }
  }

  @Command(name = "top-customers", description = "Export top 3 customers with most pending orders")
  static final class TopCustomers extends ExportCommand {

    @Option(names = "--output", description = "Output CSV file name", defaultValue = "top_customers.csv")
    Path output;

    @Override
    Report report() {
      return Report.TOP_CUSTOMERS;
    }

    @Override
    Path output() {
      return output;
    }
  }
}
